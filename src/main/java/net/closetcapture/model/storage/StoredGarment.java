package net.closetcapture.model.storage;

import jakarta.annotation.Nullable;
import net.closetcapture.model.processing.GarmentCategory;

/**
 * Storage paths for one garment, handed to the record sink after relay.
 *
 * @param ownerId           owning profile
 * @param assetId           remote processing identifier
 * @param originalPath      stored original photo
 * @param processedPath     stored background-isolated photo, null when not available
 * @param suggestedCategory category suggestion carried over from processing
 */
public record StoredGarment(
    String ownerId,
    String assetId,
    String originalPath,
    @Nullable String processedPath,
    @Nullable GarmentCategory suggestedCategory
) {

    /** Path shown to the user: processed when stored, else original. */
    public String displayPath() {
        return processedPath != null ? processedPath : originalPath;
    }
}
