package net.closetcapture.service.processing;

import reactor.core.publisher.Mono;

/**
 * Supplies a short-lived bearer token for the processing endpoint.
 *
 * <p>An empty result means there is no usable session and maps to
 * {@link net.closetcapture.exception.ProcessingErrorCode#AUTH_EXPIRED}.</p>
 */
@FunctionalInterface
public interface BearerTokenProvider {

    Mono<String> bearerToken();
}
