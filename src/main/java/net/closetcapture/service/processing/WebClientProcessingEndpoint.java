package net.closetcapture.service.processing;

import java.io.IOException;
import net.closetcapture.config.ProcessingProperties;
import net.closetcapture.exception.ProcessingErrorCode;
import net.closetcapture.exception.ProcessingException;
import net.closetcapture.model.processing.ProcessingRequest;
import net.closetcapture.model.processing.RemoteProcessingResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * {@link ProcessingEndpoint} over HTTP using the shared {@link WebClient} builder.
 *
 * <p>The idempotency key travels both in the JSON body and in the {@value #IDEMPOTENCY_KEY_HEADER}
 * header.</p>
 */
@Component
public class WebClientProcessingEndpoint implements ProcessingEndpoint {

    private static final Logger logger = LoggerFactory.getLogger(WebClientProcessingEndpoint.class);
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final WebClient webClient;
    private final String endpointUrl;

    /**
     * @param webClientBuilder     shared builder carrying the standard timeouts and codecs
     * @param processingProperties source of the endpoint URL
     */
    public WebClientProcessingEndpoint(WebClient.Builder webClientBuilder, ProcessingProperties processingProperties) {
        this.webClient = webClientBuilder.build();
        this.endpointUrl = processingProperties.getEndpointUrl();
    }

    @Override
    public Mono<RemoteProcessingResponse> invoke(ProcessingRequest request, String bearerToken) {
        return webClient.post()
            .uri(endpointUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .headers(headers -> {
                headers.setBearerAuth(bearerToken);
                headers.set(IDEMPOTENCY_KEY_HEADER, request.idempotencyKey());
            })
            .bodyValue(request)
            .retrieve()
            .bodyToMono(RemoteProcessingResponse.class)
            .switchIfEmpty(Mono.error(() -> ProcessingException.of(
                ProcessingErrorCode.SERVER_ERROR, "Processing endpoint returned an empty body")))
            .onErrorMap(error -> classify(error, request));
    }

    /**
     * Maps transport failures onto processing codes by exception type and HTTP status.
     */
    ProcessingException classify(Throwable error, ProcessingRequest request) {
        if (error instanceof ProcessingException processingException) {
            return processingException;
        }
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
                logger.warn("Processing endpoint rejected credentials for key {} (status {}).",
                    request.idempotencyKey(), status);
                return ProcessingException.of(ProcessingErrorCode.AUTH_EXPIRED,
                    "Processing endpoint rejected the bearer token (HTTP " + status + ")", responseException);
            }
            logger.warn("Processing endpoint returned HTTP {} for key {}.", status, request.idempotencyKey());
            return ProcessingException.of(ProcessingErrorCode.SERVER_ERROR,
                "Processing endpoint returned HTTP " + status, responseException);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            logger.warn("Processing endpoint unreachable for key {}: {}", request.idempotencyKey(), error.getMessage());
            return ProcessingException.of(ProcessingErrorCode.NETWORK_UNAVAILABLE,
                "Processing endpoint unreachable", error);
        }
        if (error instanceof CodecException) {
            logger.warn("Processing endpoint returned an undecodable body for key {}: {}",
                request.idempotencyKey(), error.getMessage());
            return ProcessingException.of(ProcessingErrorCode.SERVER_ERROR,
                "Processing endpoint returned a malformed body", error);
        }
        logger.error("Unexpected failure calling processing endpoint for key {}: {}",
            request.idempotencyKey(), error.getMessage(), error);
        return ProcessingException.of(ProcessingErrorCode.SERVER_ERROR, "Unexpected processing failure", error);
    }
}
