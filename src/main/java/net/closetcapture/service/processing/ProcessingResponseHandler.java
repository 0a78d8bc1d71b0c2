package net.closetcapture.service.processing;

import net.closetcapture.exception.ProcessingErrorCode;
import net.closetcapture.exception.ProcessingException;
import net.closetcapture.model.processing.GarmentCategory;
import net.closetcapture.model.processing.ProcessingResult;
import net.closetcapture.model.processing.RemoteProcessingResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Maps the processing endpoint's response onto a {@link ProcessingResult}.
 *
 * <p>A response without a processed asset is a fallback success, not a failure. A response that
 * reports failure or lacks the original asset is a retryable {@code SERVER_ERROR}.</p>
 */
@Component
public class ProcessingResponseHandler {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingResponseHandler.class);
    private static final double MIN_CONFIDENCE = 0.0;
    private static final double MAX_CONFIDENCE = 100.0;

    public ProcessingResult toResult(RemoteProcessingResponse response) {
        if (response == null) {
            throw ProcessingException.of(ProcessingErrorCode.SERVER_ERROR, "Missing processing response");
        }
        if (!response.success()) {
            throw ProcessingException.of(ProcessingErrorCode.SERVER_ERROR,
                "Processing service reported failure: " + (StringUtils.hasText(response.error()) ? response.error() : "no detail"));
        }
        RemoteProcessingResponse.Data data = response.data();
        if (data == null) {
            throw ProcessingException.of(ProcessingErrorCode.SERVER_ERROR, "Processing response has no data");
        }
        if (!StringUtils.hasText(data.originalAssetUrl()) || !StringUtils.hasText(data.assetId())) {
            throw ProcessingException.of(ProcessingErrorCode.SERVER_ERROR,
                "Processing response is missing the original asset URL or asset id");
        }

        String processedAssetUrl = StringUtils.hasText(data.processedAssetUrl()) ? data.processedAssetUrl() : null;
        if (processedAssetUrl == null) {
            logger.info("Background isolation unavailable for asset {}; keeping original as fallback.", data.assetId());
        }

        GarmentCategory category = GarmentCategory.fromLabel(data.suggestedCategory());
        if (category == null && StringUtils.hasText(data.suggestedCategory())) {
            logger.debug("Ignoring unknown category suggestion '{}' for asset {}.", data.suggestedCategory(), data.assetId());
        }
        Double confidence = category == null ? null : boundedConfidence(data.categoryConfidence());

        return new ProcessingResult(
            data.originalAssetUrl(),
            processedAssetUrl,
            data.assetId(),
            category,
            confidence
        );
    }

    private static Double boundedConfidence(Double confidence) {
        if (confidence == null || confidence.isNaN() || confidence < MIN_CONFIDENCE || confidence > MAX_CONFIDENCE) {
            return null;
        }
        return confidence;
    }
}
