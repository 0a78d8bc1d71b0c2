package net.closetcapture.service.acquisition;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import net.closetcapture.model.image.ImageDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Acquisition source over a fixed list of local files, offered one per prompt in order. Once the
 * list is exhausted every further prompt reports a cancellation. Files are never deleted on release.
 */
public class LocalFileAcquisitionSource implements AcquisitionSource {

    private static final Logger logger = LoggerFactory.getLogger(LocalFileAcquisitionSource.class);

    private final Deque<Path> remaining;

    public LocalFileAcquisitionSource(List<Path> files) {
        this.remaining = new ArrayDeque<>(files);
    }

    @Override
    public Mono<AcquisitionResult> acquire() {
        return Mono.fromCallable(() -> {
            Path next;
            synchronized (remaining) {
                next = remaining.poll();
            }
            if (next == null) {
                logger.info("No more local files to offer; treating prompt as cancelled.");
                return AcquisitionResult.cancelled();
            }
            if (!Files.isRegularFile(next) || !Files.isReadable(next)) {
                return AcquisitionResult.error("Cannot read file " + next);
            }
            long size = Files.size(next);
            Path fileName = next.getFileName();
            logger.debug("Offering local file {} ({} bytes).", next, size);
            return AcquisitionResult.picked(new ImageDescriptor(
                next.toAbsolutePath().toUri().toString(),
                fileName == null ? next.toString() : fileName.toString(),
                size,
                0,
                0,
                null
            ));
        });
    }
}
