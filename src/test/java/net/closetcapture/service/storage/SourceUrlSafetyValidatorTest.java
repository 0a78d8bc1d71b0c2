package net.closetcapture.service.storage;

import net.closetcapture.config.GarmentStorageProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceUrlSafetyValidatorTest {

    private final SourceUrlSafetyValidator validator = new SourceUrlSafetyValidator(new GarmentStorageProperties());

    @Test
    void should_Allow_When_HttpsUrlOnAllowedHost() {
        assertThat(validator.isAllowedSourceUrl("https://res.cloudinary.com/demo/image/upload/a.png")).isTrue();
        assertThat(validator.isAllowedSourceUrl("https://RES.Cloudinary.com/demo/a.png")).isTrue();
    }

    @Test
    void should_Block_When_SchemeIsNotHttps() {
        assertThat(validator.isAllowedSourceUrl("http://res.cloudinary.com/demo/a.png")).isFalse();
        assertThat(validator.isAllowedSourceUrl("file:///etc/passwd")).isFalse();
    }

    @Test
    void should_Block_When_HostOnlyResemblesAllowedHost() {
        assertThat(validator.isAllowedSourceUrl("https://res.cloudinary.com.evil.test/a.png")).isFalse();
        assertThat(validator.isAllowedSourceUrl("https://notres.cloudinary.com/a.png")).isFalse();
        assertThat(validator.isAllowedSourceUrl("https://169.254.169.254/latest/meta-data")).isFalse();
    }

    @Test
    void should_Block_When_HostIsUnlistedSubdomainOfAllowedHost() {
        assertThat(validator.isAllowedSourceUrl("https://eu.res.cloudinary.com/demo/a.png")).isFalse();
        assertThat(validator.isAllowedSourceUrl("https://attacker.res.cloudinary.com/a.png")).isFalse();
    }

    @Test
    void should_Block_When_UrlIsBlankMalformedOrCarriesUserInfo() {
        assertThat(validator.isAllowedSourceUrl(" ")).isFalse();
        assertThat(validator.isAllowedSourceUrl(null)).isFalse();
        assertThat(validator.isAllowedSourceUrl("https://res.cloudinary.com/a b|c")).isFalse();
        assertThat(validator.isAllowedSourceUrl("https://user@res.cloudinary.com/a.png")).isFalse();
    }

    @Test
    void should_UseConfiguredHosts_When_AllowListOverridden() {
        GarmentStorageProperties properties = new GarmentStorageProperties();
        properties.setAllowedSourceHosts(List.of("assets.example.com"));
        SourceUrlSafetyValidator custom = new SourceUrlSafetyValidator(properties);

        assertThat(custom.isAllowedSourceUrl("https://assets.example.com/a.png")).isTrue();
        assertThat(custom.isAllowedSourceUrl("https://res.cloudinary.com/a.png")).isFalse();
    }
}
