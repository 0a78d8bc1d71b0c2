package net.closetcapture.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed configuration for durable garment photo storage and the relay feeding it.
 */
@Component
@ConfigurationProperties(prefix = "storage")
public class GarmentStorageProperties {

    private String bucketName = "clothes-photos";
    private Duration signedUrlTtl = Duration.ofSeconds(900);
    private List<String> allowedSourceHosts = new ArrayList<>(List.of("res.cloudinary.com"));
    private List<String> allowedContentTypes = new ArrayList<>(List.of(
        "image/jpeg", "image/png", "image/webp", "image/heic"
    ));
    private String scratchDirectory = System.getProperty("java.io.tmpdir");
    private String cacheControl = "max-age=3600";

    /**
     * Returns the bucket receiving uploaded garment photos.
     */
    public String getBucketName() {
        return bucketName;
    }

    public void setBucketName(String bucketName) {
        this.bucketName = bucketName;
    }

    /**
     * Returns the lifetime of minted signed URLs.
     */
    public Duration getSignedUrlTtl() {
        return signedUrlTtl;
    }

    public void setSignedUrlTtl(Duration signedUrlTtl) {
        this.signedUrlTtl = signedUrlTtl;
    }

    /**
     * Returns the hosts a relay source URL may point at. Sub-domains of a listed host match too.
     */
    public List<String> getAllowedSourceHosts() {
        return allowedSourceHosts;
    }

    public void setAllowedSourceHosts(List<String> allowedSourceHosts) {
        this.allowedSourceHosts = allowedSourceHosts;
    }

    /**
     * Returns the content types a downloaded asset may declare.
     */
    public List<String> getAllowedContentTypes() {
        return allowedContentTypes;
    }

    public void setAllowedContentTypes(List<String> allowedContentTypes) {
        this.allowedContentTypes = allowedContentTypes;
    }

    /**
     * Returns the directory holding per-run scratch downloads.
     */
    public String getScratchDirectory() {
        return scratchDirectory;
    }

    public void setScratchDirectory(String scratchDirectory) {
        this.scratchDirectory = scratchDirectory;
    }

    public String getCacheControl() {
        return cacheControl;
    }

    public void setCacheControl(String cacheControl) {
        this.cacheControl = cacheControl;
    }
}
