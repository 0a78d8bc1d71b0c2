package net.closetcapture.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;

class S3EnvironmentConditionTest {

    @Test
    void should_ReportNothingMissing_When_PropertiesConfigured() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("s3.access-key-id", "key")
            .withProperty("s3.secret-access-key", "secret")
            .withProperty("storage.bucket-name", "clothes-photos");

        assertThat(S3EnvironmentCondition.missingSettings(environment)).isEmpty();
    }

    @Test
    void should_FallBackToEnvironmentVariables_When_PropertiesBlank() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("s3.access-key-id", " ")
            .withProperty("S3_ACCESS_KEY_ID", "key")
            .withProperty("S3_SECRET_ACCESS_KEY", "secret")
            .withProperty("S3_BUCKET", "clothes-photos");

        assertThat(S3EnvironmentCondition.missingSettings(environment)).isEmpty();
    }

    @Test
    void should_NameEachMissingSetting_When_CredentialsAbsent() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("storage.bucket-name", "clothes-photos");

        assertThat(S3EnvironmentCondition.missingSettings(environment))
            .containsExactly("s3.access-key-id/S3_ACCESS_KEY_ID", "s3.secret-access-key/S3_SECRET_ACCESS_KEY");
    }
}
