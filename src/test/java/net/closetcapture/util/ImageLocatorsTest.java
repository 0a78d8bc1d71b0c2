package net.closetcapture.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

class ImageLocatorsTest {

    @Test
    void should_StripQueryAndFragment_When_Present() {
        assertThat(ImageLocators.stripQueryAndFragment("file:///a/image.jpg?token=abc#x")).isEqualTo("file:///a/image.jpg");
        assertThat(ImageLocators.stripQueryAndFragment("photo.png#preview")).isEqualTo("photo.png");
        assertThat(ImageLocators.stripQueryAndFragment(null)).isEmpty();
    }

    @Test
    void should_ResolveLocalPath_When_LocatorIsFileUriOrPlainPath() {
        Path absolute = Paths.get("/tmp/closet/shirt.jpg").toAbsolutePath();

        assertThat(ImageLocators.toPath(absolute.toUri().toString())).isEqualTo(absolute);
        assertThat(ImageLocators.toPath("relative/shirt.jpg")).isEqualTo(Paths.get("relative/shirt.jpg"));
    }

    @Test
    void should_ReturnNull_When_LocatorIsRemoteOrBlank() {
        assertThat(ImageLocators.toPath("content://media/external/images/1")).isNull();
        assertThat(ImageLocators.toPath("https://res.cloudinary.com/a.jpg")).isNull();
        assertThat(ImageLocators.toPath(" ")).isNull();
    }
}
