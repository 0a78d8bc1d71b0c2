package net.closetcapture.testutil;

import net.closetcapture.exception.RelayException;
import net.closetcapture.exception.RelayFailureReason;
import net.closetcapture.service.storage.BlobStorageGateway;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Blob storage kept in memory, recording uploads and removals. */
public class InMemoryBlobStorageGateway implements BlobStorageGateway {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final List<String> removed = new CopyOnWriteArrayList<>();
    private volatile Runnable afterUpload = () -> { };

    @Override
    public Mono<Void> upload(String path, byte[] bytes, String contentType) {
        return Mono.fromRunnable(() -> {
            objects.put(path, bytes.clone());
            afterUpload.run();
        });
    }

    @Override
    public Mono<String> createSignedUrl(String path, Duration ttl) {
        if (!objects.containsKey(path)) {
            return Mono.error(new RelayException(RelayFailureReason.SIGNING_FAILED, "No such object", path));
        }
        return Mono.just("https://storage.test/clothes-photos/" + path + "?X-Amz-Expires=" + ttl.getSeconds());
    }

    @Override
    public Mono<Void> remove(String path) {
        return Mono.fromRunnable(() -> {
            objects.remove(path);
            removed.add(path);
        });
    }

    /** Runs {@code hook} after every stored upload. */
    public void afterUpload(Runnable hook) {
        this.afterUpload = hook;
    }

    public Map<String, byte[]> objects() {
        return objects;
    }

    public List<String> removed() {
        return removed;
    }
}
