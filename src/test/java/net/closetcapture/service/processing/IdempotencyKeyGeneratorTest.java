package net.closetcapture.service.processing;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotencyKeyGeneratorTest {

    @Test
    void should_PrefixEpochMillisAndStayUnique_When_ClockIsFrozen() {
        Clock frozen = Clock.fixed(Instant.ofEpochMilli(1_718_900_000_000L), ZoneOffset.UTC);
        IdempotencyKeyGenerator generator = new IdempotencyKeyGenerator(frozen);

        Set<String> keys = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            String key = generator.nextKey();
            assertThat(key).startsWith("1718900000000_").hasSize("1718900000000_".length() + 8);
            keys.add(key);
        }

        assertThat(keys).hasSize(500);
    }
}
