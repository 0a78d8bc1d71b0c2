package net.closetcapture.util;

import jakarta.annotation.Nullable;

import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers for the locators acquisition sources hand out (plain paths or {@code file:} URIs).
 */
public final class ImageLocators {

    private static final Logger log = LoggerFactory.getLogger(ImageLocators.class);

    private ImageLocators() {
    }

    /**
     * Removes any {@code ?query} and {@code #fragment} suffix.
     *
     * <pre>
     * ImageLocators.stripQueryAndFragment("file:///a/image.jpg?token=abc") → "file:///a/image.jpg"
     * ImageLocators.stripQueryAndFragment("photo.png#preview")             → "photo.png"
     * </pre>
     */
    public static String stripQueryAndFragment(String locator) {
        if (locator == null) {
            return "";
        }
        String clean = locator;
        int queryIndex = clean.indexOf('?');
        if (queryIndex >= 0) {
            clean = clean.substring(0, queryIndex);
        }
        int fragmentIndex = clean.indexOf('#');
        if (fragmentIndex >= 0) {
            clean = clean.substring(0, fragmentIndex);
        }
        return clean;
    }

    /**
     * Resolves a locator to a local path.
     *
     * @return the path, or null when the locator is not a local file reference
     */
    @Nullable
    public static Path toPath(@Nullable String locator) {
        if (locator == null || locator.isBlank()) {
            return null;
        }
        String clean = stripQueryAndFragment(locator);
        try {
            if (clean.startsWith("file:")) {
                return Paths.get(URI.create(clean));
            }
            if (clean.contains("://")) {
                return null;
            }
            return Paths.get(clean);
        } catch (IllegalArgumentException | FileSystemNotFoundException ex) {
            log.debug("Locator '{}' is not a local path: {}", locator, ex.getMessage());
            return null;
        }
    }
}
