package net.closetcapture.service.image;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.closetcapture.model.image.ImageDescriptor;
import net.closetcapture.model.image.ValidationOutcome;
import net.closetcapture.util.ImageLocators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Accepts or rejects acquired images by file extension and byte size.
 *
 * <p>Rejections carry a user-facing message; the size message reports the offending size in MB
 * rounded to one decimal next to the ceiling.</p>
 */
@Component
public class ImageFormatValidator {

    private static final Logger logger = LoggerFactory.getLogger(ImageFormatValidator.class);

    public static final long MAX_FILE_SIZE_BYTES = 10L * 1024 * 1024;
    public static final List<String> ALLOWED_EXTENSIONS = List.of("jpg", "jpeg", "png", "heic", "heif", "webp");
    private static final String DEFAULT_MIME_TYPE = "image/jpeg";
    private static final Map<String, String> MIME_TYPES_BY_EXTENSION = Map.of(
        "jpg", "image/jpeg",
        "jpeg", "image/jpeg",
        "png", "image/png",
        "heic", "image/heic",
        "heif", "image/heif",
        "webp", "image/webp"
    );
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    /**
     * Validates a descriptor: format first, then size.
     *
     * @param descriptor image handed over by the acquisition source
     * @return ACCEPTED with the effective size, or a typed rejection
     */
    public ValidationOutcome validate(ImageDescriptor descriptor) {
        String nameForExtension = hasText(descriptor.fileName()) ? descriptor.fileName() : descriptor.locator();
        String extension = extractExtension(nameForExtension);
        if (!validateFormat(extension)) {
            logger.info("Rejected image {} with unsupported extension '{}'.", nameForExtension, extension);
            return ValidationOutcome.invalidFormat(
                "Unsupported format. Accepted formats: " + String.join(", ", ALLOWED_EXTENSIONS));
        }

        long byteSize = resolveByteSize(descriptor);
        if (!validateSize(byteSize)) {
            logger.info("Rejected image {} of {} bytes (maximum {} bytes).", nameForExtension, byteSize, MAX_FILE_SIZE_BYTES);
            return ValidationOutcome.fileTooLarge(tooLargeMessage(byteSize), byteSize);
        }
        return ValidationOutcome.accepted(descriptor, byteSize);
    }

    /**
     * @return true iff {@code extension} is on the allow-list, ignoring case
     */
    public boolean validateFormat(String extension) {
        if (extension == null || extension.isBlank()) {
            return false;
        }
        return ALLOWED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * @return true iff {@code bytes} does not exceed the 10 MiB ceiling
     */
    public boolean validateSize(long bytes) {
        return bytes <= MAX_FILE_SIZE_BYTES;
    }

    /**
     * Builds the rejection message for an oversized image, e.g. {@code Image too large (15.0MB). Maximum: 10MB}.
     */
    public String tooLargeMessage(long bytes) {
        String sizeMb = String.format(Locale.ROOT, "%.1f", bytes / BYTES_PER_MB);
        return "Image too large (" + sizeMb + "MB). Maximum: " + (MAX_FILE_SIZE_BYTES / (1024 * 1024)) + "MB";
    }

    /**
     * Extracts the lowercase extension from a file name or URI, ignoring any query or fragment.
     *
     * @return the extension, or an empty string when there is none
     */
    public String extractExtension(String fileNameOrUri) {
        if (fileNameOrUri == null) {
            return "";
        }
        String cleanPath = ImageLocators.stripQueryAndFragment(fileNameOrUri);
        int lastDotIndex = cleanPath.lastIndexOf('.');
        int lastSlashIndex = cleanPath.lastIndexOf('/');
        if (lastDotIndex == -1 || lastDotIndex == cleanPath.length() - 1 || lastDotIndex < lastSlashIndex) {
            return "";
        }
        return cleanPath.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves the MIME type from a file name or URI, defaulting to JPEG.
     */
    public String mimeTypeFor(String fileNameOrUri) {
        return MIME_TYPES_BY_EXTENSION.getOrDefault(extractExtension(fileNameOrUri), DEFAULT_MIME_TYPE);
    }

    /**
     * On-disk size when the locator is readable, else the declared size, else 0.
     */
    long resolveByteSize(ImageDescriptor descriptor) {
        Path path = ImageLocators.toPath(descriptor.locator());
        if (path != null) {
            try {
                if (Files.isRegularFile(path)) {
                    return Files.size(path);
                }
            } catch (IOException | SecurityException e) {
                logger.debug("Could not stat {}; using declared size {}: {}", path, descriptor.byteSize(), e.getMessage());
            }
        }
        return Math.max(descriptor.byteSize(), 0L);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
