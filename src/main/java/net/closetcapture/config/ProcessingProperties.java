package net.closetcapture.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed configuration for the remote processing call and the compression profiles feeding it.
 */
@Component
@ConfigurationProperties(prefix = "processing")
public class ProcessingProperties {

    private String endpointUrl = "http://localhost:54321/functions/v1/process-clothing-image";
    private Duration timeout = Duration.ofSeconds(10);
    private int maxRetries = 1;
    private String bearerToken = "";
    private int previewMaxEdge = 2048;
    private float previewQuality = 0.8f;
    private int submissionMaxEdge = 1500;
    private float submissionQuality = 0.85f;

    /**
     * Returns the absolute URL of the remote processing endpoint.
     */
    public String getEndpointUrl() {
        return endpointUrl;
    }

    public void setEndpointUrl(String endpointUrl) {
        this.endpointUrl = endpointUrl;
    }

    /**
     * Returns the per-attempt timeout raced against the remote call.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Returns how many times a retryable failure is re-issued automatically.
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    /**
     * Returns the static bearer token used when no session-backed provider is wired.
     */
    public String getBearerToken() {
        return bearerToken;
    }

    public void setBearerToken(String bearerToken) {
        this.bearerToken = bearerToken;
    }

    public int getPreviewMaxEdge() {
        return previewMaxEdge;
    }

    public void setPreviewMaxEdge(int previewMaxEdge) {
        this.previewMaxEdge = previewMaxEdge;
    }

    public float getPreviewQuality() {
        return previewQuality;
    }

    public void setPreviewQuality(float previewQuality) {
        this.previewQuality = previewQuality;
    }

    public int getSubmissionMaxEdge() {
        return submissionMaxEdge;
    }

    public void setSubmissionMaxEdge(int submissionMaxEdge) {
        this.submissionMaxEdge = submissionMaxEdge;
    }

    public float getSubmissionQuality() {
        return submissionQuality;
    }

    public void setSubmissionQuality(float submissionQuality) {
        this.submissionQuality = submissionQuality;
    }
}
