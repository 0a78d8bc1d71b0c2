package net.closetcapture.model.processing;

import jakarta.annotation.Nullable;

/**
 * Successful outcome of remote processing.
 *
 * <p>{@code usedFallback} is derived, never passed: it is true exactly when no processed asset was
 * produced. A fallback result is still a success and {@code originalAssetUrl} is usable.</p>
 *
 * @param originalAssetUrl   remote URL of the uploaded original
 * @param processedAssetUrl  remote URL of the background-isolated asset, null on fallback
 * @param assetId            remote identifier of the asset
 * @param usedFallback       true iff {@code processedAssetUrl} is null
 * @param suggestedCategory  category suggestion, null when none was made
 * @param categoryConfidence confidence of the suggestion on a 0-100 scale, null when none
 */
public record ProcessingResult(
    String originalAssetUrl,
    @Nullable String processedAssetUrl,
    String assetId,
    boolean usedFallback,
    @Nullable GarmentCategory suggestedCategory,
    @Nullable Double categoryConfidence
) {

    public ProcessingResult {
        if (originalAssetUrl == null || originalAssetUrl.isBlank()) {
            throw new IllegalArgumentException("originalAssetUrl is required");
        }
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("assetId is required");
        }
        if (processedAssetUrl != null && processedAssetUrl.isBlank()) {
            processedAssetUrl = null;
        }
        usedFallback = processedAssetUrl == null;
    }

    public ProcessingResult(String originalAssetUrl,
                            @Nullable String processedAssetUrl,
                            String assetId,
                            @Nullable GarmentCategory suggestedCategory,
                            @Nullable Double categoryConfidence) {
        this(originalAssetUrl, processedAssetUrl, assetId, processedAssetUrl == null, suggestedCategory, categoryConfidence);
    }

    /** URL best suited for display: the processed asset when present, else the original. */
    public String displayAssetUrl() {
        return processedAssetUrl != null ? processedAssetUrl : originalAssetUrl;
    }
}
