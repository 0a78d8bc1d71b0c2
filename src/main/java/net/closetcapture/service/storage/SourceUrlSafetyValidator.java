package net.closetcapture.service.storage;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import net.closetcapture.config.GarmentStorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates relay source URLs against a strict HTTPS host allowlist before any network I/O.
 * Hosts match exactly; a sub-domain of a listed host must be listed itself.
 */
@Component
public class SourceUrlSafetyValidator {

    private static final Logger log = LoggerFactory.getLogger(SourceUrlSafetyValidator.class);

    private final List<String> allowedHosts;

    public SourceUrlSafetyValidator(GarmentStorageProperties storageProperties) {
        this.allowedHosts = storageProperties.getAllowedSourceHosts().stream()
            .filter(host -> host != null && !host.isBlank())
            .map(host -> host.trim().toLowerCase(Locale.ROOT))
            .toList();
    }

    public boolean isAllowedSourceUrl(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            log.warn("Blank relay source URL provided, blocking.");
            return false;
        }
        try {
            URI uri = URI.create(sourceUrl);
            return isAllowedHost(uri);
        } catch (IllegalArgumentException exception) {
            log.warn("Invalid relay source URL format, blocking: {}", sourceUrl);
            return false;
        }
    }

    private boolean isAllowedHost(URI uri) {
        if (!"https".equalsIgnoreCase(uri.getScheme())) {
            log.warn("Blocked non-HTTPS relay source: {}", uri);
            return false;
        }
        if (uri.getUserInfo() != null) {
            log.warn("Blocked relay source carrying user info: {}", uri.getHost());
            return false;
        }

        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return false;
        }

        String normalizedHost = host.toLowerCase(Locale.ROOT);
        if (allowedHosts.contains(normalizedHost)) {
            return true;
        }
        log.warn("Blocked relay source host outside the allowlist: {}", host);
        return false;
    }
}
