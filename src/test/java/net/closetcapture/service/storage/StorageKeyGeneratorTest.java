package net.closetcapture.service.storage;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StorageKeyGeneratorTest {

    private final StorageKeyGenerator generator =
        new StorageKeyGenerator(Clock.fixed(Instant.ofEpochMilli(1_718_900_000_123L), ZoneOffset.UTC));

    @Test
    void should_PrefixOwnerAndUseJpgName_When_OwnerIsPathSafe() {
        String path = generator.generatePath("profile_42-a");

        assertThat(path).matches("profile_42-a/1718900000123_[0-9a-f]{16}\\.jpg");
    }

    @Test
    void should_GenerateDistinctPaths_When_CalledInSameMillisecond() {
        assertThat(generator.generatePath("p1")).isNotEqualTo(generator.generatePath("p1"));
    }

    @Test
    void should_Reject_When_OwnerIdCouldEscapePrefix() {
        assertThatThrownBy(() -> generator.generatePath("../other")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.generatePath("a/b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.generatePath(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
