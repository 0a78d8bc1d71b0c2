package net.closetcapture.service.processing;

import java.security.SecureRandom;
import java.time.Clock;
import org.springframework.stereotype.Component;

/**
 * Mints idempotency keys of the form {@code {epochMillis}_{8 base36 chars}}, unique even for
 * actions started in the same millisecond.
 */
@Component
public class IdempotencyKeyGenerator {

    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int RANDOM_LENGTH = 8;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public IdempotencyKeyGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextKey() {
        StringBuilder key = new StringBuilder(24);
        key.append(clock.millis()).append('_');
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            key.append(BASE36[random.nextInt(BASE36.length)]);
        }
        return key.toString();
    }
}
