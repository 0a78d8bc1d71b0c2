package net.closetcapture.model.processing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.annotation.Nullable;

/**
 * Wire shape of the processing endpoint's JSON response.
 *
 * @param success whether the remote call succeeded
 * @param data    asset data, present on success
 * @param error   remote error description, informational only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteProcessingResponse(
    boolean success,
    @Nullable Data data,
    @Nullable String error
) {

    /**
     * @param originalAssetUrl   remote URL of the original
     * @param processedAssetUrl  remote URL of the processed asset, null when isolation failed
     * @param assetId            remote identifier
     * @param suggestedCategory  free-form category label
     * @param categoryConfidence confidence on a 0-100 scale
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(
        @Nullable String originalAssetUrl,
        @Nullable String processedAssetUrl,
        @Nullable String assetId,
        @Nullable String suggestedCategory,
        @Nullable Double categoryConfidence
    ) {}
}
