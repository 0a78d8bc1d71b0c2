package net.closetcapture.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed configuration for the capture pipeline as a whole.
 */
@Component
@ConfigurationProperties(prefix = "capture")
public class CaptureProperties {

    private int maxReacquisitions = 3;

    /**
     * Returns how many times acquisition is re-prompted after a recoverable validation failure.
     */
    public int getMaxReacquisitions() {
        return maxReacquisitions;
    }

    public void setMaxReacquisitions(int maxReacquisitions) {
        this.maxReacquisitions = maxReacquisitions;
    }
}
