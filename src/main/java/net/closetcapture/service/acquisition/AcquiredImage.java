package net.closetcapture.service.acquisition;

import net.closetcapture.model.image.ImageDescriptor;

/**
 * A validated image loaded into memory.
 *
 * @param descriptor the accepted descriptor
 * @param bytes      raw bytes read from the locator
 * @param mimeType   MIME type of {@code bytes}
 */
public record AcquiredImage(ImageDescriptor descriptor, byte[] bytes, String mimeType) {
}
