package net.closetcapture.config;

import java.net.URI;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * S3 client and presigner for garment photo storage.
 *
 * <p>Both beans share region, credentials and an optional endpoint override, so any
 * S3-compatible store (MinIO, Supabase storage) works with path-style access. A misconfigured
 * client fails startup instead of failing the first upload.</p>
 */
@Configuration
@Conditional(S3EnvironmentCondition.class)
public class S3Config {

    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    private final String accessKeyId;
    private final String secretAccessKey;
    private final String serverUrl;
    private final String region;
    private final boolean pathStyleAccess;

    public S3Config(@Value("${s3.access-key-id:${S3_ACCESS_KEY_ID:}}") String accessKeyId,
                    @Value("${s3.secret-access-key:${S3_SECRET_ACCESS_KEY:}}") String secretAccessKey,
                    @Value("${s3.server-url:${S3_SERVER_URL:}}") String serverUrl,
                    @Value("${s3.region:${AWS_REGION:us-east-1}}") String region,
                    @Value("${s3.path-style-access:true}") boolean pathStyleAccess) {
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey;
        this.serverUrl = serverUrl;
        this.region = region;
        this.pathStyleAccess = pathStyleAccess;
    }

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        try {
            var builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentials())
                .serviceConfiguration(serviceConfiguration());
            URI endpoint = endpointOverride();
            if (endpoint != null) {
                builder.endpointOverride(endpoint);
            }
            logger.info("S3Client ready (region={}, endpoint={}, pathStyle={})",
                region, endpoint == null ? "aws-managed" : endpoint, pathStyleAccess);
            return builder.build();
        } catch (RuntimeException ex) {
            logger.error("Failed to create S3Client", ex);
            throw new IllegalStateException("Failed to configure S3Client", ex);
        }
    }

    /**
     * Signs read URLs locally; no network call is made when minting.
     */
    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner() {
        try {
            var builder = S3Presigner.builder()
                .region(Region.of(region))
                .credentialsProvider(credentials())
                .serviceConfiguration(serviceConfiguration());
            URI endpoint = endpointOverride();
            if (endpoint != null) {
                builder.endpointOverride(endpoint);
            }
            return builder.build();
        } catch (RuntimeException ex) {
            logger.error("Failed to create S3Presigner", ex);
            throw new IllegalStateException("Failed to configure S3Presigner", ex);
        }
    }

    private AwsCredentialsProvider credentials() {
        if (isBlank(accessKeyId) || isBlank(secretAccessKey)) {
            throw new IllegalStateException(
                "S3 credentials are incomplete: set s3.access-key-id and s3.secret-access-key");
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    }

    private S3Configuration serviceConfiguration() {
        return S3Configuration.builder()
            .pathStyleAccessEnabled(pathStyleAccess)
            .build();
    }

    private URI endpointOverride() {
        return isBlank(serverUrl) ? null : URI.create(serverUrl.trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
