package net.closetcapture.application.capture;

import jakarta.annotation.Nullable;
import net.closetcapture.model.processing.ProcessingResult;
import net.closetcapture.model.storage.StorageRecord;
import net.closetcapture.model.storage.StoredGarment;

/**
 * Terminal result of one capture run.
 *
 * @param status           outcome kind
 * @param code             structured failure code, null for STORED and CANCELLED
 * @param userMessage      single user-facing message, null for STORED and CANCELLED
 * @param garment          stored paths, only for STORED
 * @param recordId         id returned by the record sink, only for STORED
 * @param storageRecord    signed URL for the display path, only for STORED
 * @param processingResult remote result, when processing got that far
 */
public record CaptureOutcome(
    Status status,
    @Nullable String code,
    @Nullable String userMessage,
    @Nullable StoredGarment garment,
    @Nullable String recordId,
    @Nullable StorageRecord storageRecord,
    @Nullable ProcessingResult processingResult
) {

    public enum Status {
        STORED,
        CANCELLED,
        VALIDATION_FAILED,
        PROCESSING_FAILED,
        RELAY_FAILED
    }

    static CaptureOutcome stored(StoredGarment garment, String recordId, StorageRecord storageRecord,
                                 ProcessingResult processingResult) {
        return new CaptureOutcome(Status.STORED, null, null, garment, recordId, storageRecord, processingResult);
    }

    static CaptureOutcome cancelled() {
        return new CaptureOutcome(Status.CANCELLED, null, null, null, null, null, null);
    }

    static CaptureOutcome validationFailed(String code, String userMessage) {
        return new CaptureOutcome(Status.VALIDATION_FAILED, code, userMessage, null, null, null, null);
    }

    static CaptureOutcome processingFailed(String code, String userMessage) {
        return new CaptureOutcome(Status.PROCESSING_FAILED, code, userMessage, null, null, null, null);
    }

    static CaptureOutcome relayFailed(String code, String userMessage, @Nullable ProcessingResult processingResult) {
        return new CaptureOutcome(Status.RELAY_FAILED, code, userMessage, null, null, null, processingResult);
    }

    public boolean isStored() {
        return status == Status.STORED;
    }
}
