package net.closetcapture.model.storage;

import java.time.Instant;

/**
 * A stored object together with a freshly minted signed URL.
 *
 * <p>The signed URL can be re-minted from {@code storagePath} at any time.</p>
 *
 * @param storagePath object path inside the garment bucket, {@code {ownerId}/{generatedName}}
 * @param signedUrl   time-limited read URL
 * @param expiresAt   last instant at which {@code signedUrl} is valid
 */
public record StorageRecord(String storagePath, String signedUrl, Instant expiresAt) {

    /** Whether the signed URL is still usable at {@code instant}; valid through {@code expiresAt} inclusive. */
    public boolean isValidAt(Instant instant) {
        return !instant.isAfter(expiresAt);
    }
}
