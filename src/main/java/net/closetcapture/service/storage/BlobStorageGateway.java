package net.closetcapture.service.storage;

import java.time.Duration;
import reactor.core.publisher.Mono;

/**
 * Durable blob storage for garment photos, addressed by path inside one bucket.
 */
public interface BlobStorageGateway {

    Mono<Void> upload(String path, byte[] bytes, String contentType);

    /**
     * Mints a time-limited read URL for {@code path}.
     */
    Mono<String> createSignedUrl(String path, Duration ttl);

    Mono<Void> remove(String path);
}
