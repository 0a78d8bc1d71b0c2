package net.closetcapture.service.processing;

/** Phases of one processing action. */
public enum ProcessingPhase {
    IDLE,
    COMPRESSING,
    ENCODING,
    REQUESTING,
    RETRYING,
    SUCCESS,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }
}
