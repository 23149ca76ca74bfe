package com.delta.digest.aggregate.download;

import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.ImageReference;
import com.delta.digest.aggregate.model.SourceType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImageFileNamesTest {

    @Test
    void nameIsBuiltFromStableEntryAttributes() {
        Entry entry = new Entry("0a1b2c3d4e5f6789", SourceType.STRUCTURED_API, "Hacker News", "t", "", "https://x.example.com", null, List.of(), null);
        ImageReference image = new ImageReference("https://x.example.com/cover.JPEG", ImageReference.KIND_OG_IMAGE, 0);

        assertThat(ImageFileNames.baseName(entry, image)).isEqualTo("hacker-news_og-image_0a1b2c3d-0");
        assertThat(ImageFileNames.baseName(entry, image)).isEqualTo(ImageFileNames.baseName(entry, image));
    }

    @Test
    void extensionsFromUrlOrMediaType() {
        assertThat(ImageFileNames.extensionFromUrl("https://x.example.com/cover.JPEG")).isEqualTo("jpg");
        assertThat(ImageFileNames.extensionFromUrl("https://x.example.com/render.php")).isNull();
        assertThat(ImageFileNames.extensionFromMediaType("image/svg+xml")).isEqualTo("svg");
        assertThat(ImageFileNames.extensionFromMediaType("application/octet-stream")).isNull();
    }
}
