package net.closetcapture.service.acquisition;

import net.closetcapture.model.image.ImageDescriptor;
import reactor.core.publisher.Mono;

/**
 * Wraps a capture or selection surface.
 */
public interface AcquisitionSource {

    /**
     * Prompts for one image. Each subscription is a new prompt.
     */
    Mono<AcquisitionResult> acquire();

    /**
     * Frees whatever the source holds for {@code descriptor}, such as a temporary capture file.
     * Called once per acquired descriptor, whatever the pipeline outcome.
     */
    default Mono<Void> release(ImageDescriptor descriptor) {
        return Mono.empty();
    }
}
