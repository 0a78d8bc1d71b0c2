package net.closetcapture.application.capture;

import net.closetcapture.model.storage.StoredGarment;
import reactor.core.publisher.Mono;

/**
 * Persists the garment row once its photos are stored.
 */
@FunctionalInterface
public interface GarmentRecordSink {

    /**
     * @return the id of the persisted record
     */
    Mono<String> save(StoredGarment garment);
}
