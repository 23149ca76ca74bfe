package com.delta.digest.aggregate.media;

import com.delta.digest.aggregate.model.ImageReference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PaperFigureScannerTest {

    @Test
    void dimensionsAreParsedLeniently() {
        assertThat(PaperFigureScanner.parseLeadingInt("640")).isEqualTo(640);
        assertThat(PaperFigureScanner.parseLeadingInt(" 700px")).isEqualTo(700);
        assertThat(PaperFigureScanner.parseLeadingInt("auto")).isNull();
        assertThat(PaperFigureScanner.parseLeadingInt("")).isNull();
    }

    @Test
    void onlyOneDeclaredDimensionKeepsTheImage() {
        PaperFigureScanner scanner = new PaperFigureScanner(5, 200);
        String html = "<img src=\"x1.png\" width=\"50\"><img src=\"latex_render.png\" width=\"900\" height=\"900\">"
            + "<img src=\"pipeline.svg\" class=\"ltx_graphics\">";

        List<ImageReference> images = scanner.scan(html, "https://arxiv.org/html/1234.5678/");

        assertThat(images).extracting(ImageReference::url)
            .containsExactly("https://arxiv.org/html/1234.5678/x1.png", "https://arxiv.org/html/1234.5678/pipeline.svg");
        assertThat(images.get(1).kind()).isEqualTo(ImageReference.KIND_DIAGRAM);
    }
}
