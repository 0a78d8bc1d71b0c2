package net.closetcapture.service.processing;

import net.closetcapture.model.processing.ProcessingRequest;
import net.closetcapture.model.processing.RemoteProcessingResponse;
import reactor.core.publisher.Mono;

/**
 * Transport to the remote background-isolation and categorization service.
 *
 * <p>Implementations report failures only as
 * {@link net.closetcapture.exception.ProcessingException} with a structured code.</p>
 */
public interface ProcessingEndpoint {

    Mono<RemoteProcessingResponse> invoke(ProcessingRequest request, String bearerToken);
}
