package net.closetcapture.service.processing;

import net.closetcapture.config.ProcessingProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Bearer token taken from {@code processing.bearer-token}, for service accounts and local runs.
 */
@Component
public class ConfiguredBearerTokenProvider implements BearerTokenProvider {

    private final ProcessingProperties processingProperties;

    public ConfiguredBearerTokenProvider(ProcessingProperties processingProperties) {
        this.processingProperties = processingProperties;
    }

    @Override
    public Mono<String> bearerToken() {
        return Mono.fromSupplier(processingProperties::getBearerToken)
            .filter(StringUtils::hasText);
    }
}
