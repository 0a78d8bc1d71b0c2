package net.closetcapture.config;

import net.closetcapture.service.storage.BlobStorageGateway;
import net.closetcapture.support.s3.S3BlobStorageGateway;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Wires the blob storage gateway. Without S3 credentials the gateway still starts, and every
 * storage call fails with a storage-unavailable relay error.
 */
@Configuration
public class StorageConfig {

    @Bean
    public BlobStorageGateway blobStorageGateway(ObjectProvider<S3Client> s3Client,
                                                 ObjectProvider<S3Presigner> s3Presigner,
                                                 GarmentStorageProperties storageProperties,
                                                 @Qualifier(SchedulerConfig.IO_SCHEDULER) Scheduler ioScheduler) {
        S3BlobStorageGateway gateway = new S3BlobStorageGateway(
            s3Client.getIfAvailable(),
            s3Presigner.getIfAvailable(),
            storageProperties.getBucketName(),
            storageProperties.getCacheControl(),
            ioScheduler
        );
        gateway.validateConfiguration();
        return gateway;
    }
}
