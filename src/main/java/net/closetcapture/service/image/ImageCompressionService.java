package net.closetcapture.service.image;

import net.closetcapture.model.image.CompressedImage;
import net.closetcapture.model.image.CompressionProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Service for resizing and re-encoding garment photos before preview and submission
 *
 * Features:
 * - Bounds the longest edge to the profile's maximum, preserving aspect ratio
 * - Never upscales small images
 * - Flattens transparency onto white and converts to RGB for the JPEG writer
 * - Compresses to JPEG with the profile's quality
 * - Falls back to the original bytes, flagged, when the image cannot be decoded or encoded
 */
@Service
public class ImageCompressionService {

    private static final Logger logger = LoggerFactory.getLogger(ImageCompressionService.class);

    /**
     * Compresses an image for the given profile.
     *
     * @param rawImageBytes  the bytes read from the acquired image
     * @param sourceMimeType MIME type of {@code rawImageBytes}, reported on the fallback path
     * @param profile        longest-edge and quality bounds
     * @param imageIdForLog  identifier for log lines
     * @return the JPEG result, or the untouched input with {@code fallbackToOriginal} set
     *
     * @implNote Identical inputs and profiles always produce identical bytes: the resize uses fixed
     * bilinear interpolation and the JPEG writer has no time-dependent metadata.
     */
    public CompressedImage compress(byte[] rawImageBytes, String sourceMimeType, CompressionProfile profile, String imageIdForLog) {
        if (rawImageBytes == null || rawImageBytes.length == 0) {
            logger.warn("Image {}: Raw image bytes are null or empty. Nothing to compress.", imageIdForLog);
            return CompressedImage.passthrough(rawImageBytes == null ? new byte[0] : rawImageBytes, sourceMimeType, "empty input");
        }

        try (ByteArrayInputStream bais = new ByteArrayInputStream(rawImageBytes)) {
            BufferedImage decoded = ImageIO.read(bais);
            if (decoded == null) {
                logger.warn("Image {}: No ImageIO reader for {} ({} bytes). Passing original bytes through uncompressed.",
                    imageIdForLog, sourceMimeType, rawImageBytes.length);
                return CompressedImage.passthrough(rawImageBytes, sourceMimeType, "unreadable image");
            }

            int originalWidth = decoded.getWidth();
            int originalHeight = decoded.getHeight();
            int longestEdge = Math.max(originalWidth, originalHeight);

            int newWidth = originalWidth;
            int newHeight = originalHeight;
            if (longestEdge > profile.maxEdge()) {
                double scale = (double) profile.maxEdge() / longestEdge;
                newWidth = Math.max(1, Math.min(profile.maxEdge(), (int) Math.round(originalWidth * scale)));
                newHeight = Math.max(1, Math.min(profile.maxEdge(), (int) Math.round(originalHeight * scale)));
                logger.debug("Image {}: Resizing from {}x{} to {}x{} (max edge {}).",
                    imageIdForLog, originalWidth, originalHeight, newWidth, newHeight, profile.maxEdge());
            } else {
                logger.debug("Image {}: Longest edge {} within max edge {}. Keeping original dimensions.",
                    imageIdForLog, longestEdge, profile.maxEdge());
            }

            BufferedImage outputImage = toRgb(decoded, newWidth, newHeight);
            return compressImageToJpeg(outputImage, rawImageBytes, sourceMimeType, profile.quality(), imageIdForLog);

        } catch (IOException e) {
            logger.warn("Image {}: IOException during compression, passing original bytes through: {}", imageIdForLog, e.getMessage(), e);
            return CompressedImage.passthrough(rawImageBytes, sourceMimeType, "IOException during compression: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Image {}: Unexpected exception during compression, passing original bytes through: {}", imageIdForLog, e.getMessage(), e);
            return CompressedImage.passthrough(rawImageBytes, sourceMimeType, "Unexpected error during compression: " + e.getMessage());
        }
    }

    /**
     * Draws the source onto an opaque RGB canvas of the target size; transparent pixels become white.
     */
    private BufferedImage toRgb(BufferedImage source, int width, int height) {
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private CompressedImage compressImageToJpeg(BufferedImage imageToCompress,
                                                byte[] rawImageBytes,
                                                String sourceMimeType,
                                                float quality,
                                                String imageIdForLog) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            logger.error("Image {}: No JPEG ImageWriters found. Passing original bytes through.", imageIdForLog);
            return CompressedImage.passthrough(rawImageBytes, sourceMimeType, "No JPEG ImageWriters available");
        }
        ImageWriter writer = writers.next();
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageWriteParam jpegParams = writer.getDefaultWriteParam();
            jpegParams.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            jpegParams.setCompressionQuality(quality);

            try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
                writer.setOutput(ios);
                writer.write(null, new IIOImage(imageToCompress, null, null), jpegParams);
            }

            byte[] compressedBytes = baos.toByteArray();
            logger.info("Image {}: Compressed {} bytes to {} bytes JPEG at {}x{} (quality {}).",
                imageIdForLog, rawImageBytes.length, compressedBytes.length,
                imageToCompress.getWidth(), imageToCompress.getHeight(), quality);
            return CompressedImage.jpeg(compressedBytes, imageToCompress.getWidth(), imageToCompress.getHeight());
        } finally {
            writer.dispose();
        }
    }
}
