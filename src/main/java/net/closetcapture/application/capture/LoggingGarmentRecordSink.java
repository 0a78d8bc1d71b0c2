package net.closetcapture.application.capture;

import java.util.UUID;
import net.closetcapture.model.storage.StoredGarment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Record sink used when no wardrobe database is attached: assigns an id and logs the row.
 */
@Component
public class LoggingGarmentRecordSink implements GarmentRecordSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingGarmentRecordSink.class);

    @Override
    public Mono<String> save(StoredGarment garment) {
        return Mono.fromSupplier(() -> {
            String recordId = UUID.randomUUID().toString();
            logger.info("Garment record {} for owner {}: asset={}, original={}, processed={}, category={}",
                recordId, garment.ownerId(), garment.assetId(), garment.originalPath(),
                garment.processedPath(), garment.suggestedCategory());
            return recordId;
        });
    }
}
