package net.closetcapture.service.storage;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Single source of truth for storage paths of relayed garment photos.
 *
 * Key format: {ownerId}/{epochMillis}_{16 hex}.jpg
 * Example: 7f3c2a9e-profile/1718900000000_9f86d081884c7d65.jpg
 */
@Component
public class StorageKeyGenerator {

    private static final Pattern OWNER_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String EXTENSION = ".jpg";
    private static final int RANDOM_BYTES = 8;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public StorageKeyGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Generates a fresh storage path under the owner's prefix.
     *
     * @throws IllegalArgumentException if ownerId is not path-safe
     */
    public String generatePath(String ownerId) {
        validateOwnerId(ownerId);
        return ownerId + "/" + generateFileName();
    }

    String generateFileName() {
        byte[] suffix = new byte[RANDOM_BYTES];
        random.nextBytes(suffix);
        return clock.millis() + "_" + HexFormat.of().formatHex(suffix) + EXTENSION;
    }

    /**
     * Rejects owner ids that could escape their prefix or produce unusable keys.
     */
    public static void validateOwnerId(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id cannot be null or blank");
        }
        if (!OWNER_ID_PATTERN.matcher(ownerId).matches()) {
            throw new IllegalArgumentException("Owner id contains characters not allowed in a storage path: " + ownerId);
        }
    }
}
