package com.delta.digest.aggregate.media;

import com.delta.digest.aggregate.http.PoliteHttpClient;
import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.ImageReference;
import com.delta.digest.aggregate.model.ImageStrategy;
import com.delta.digest.aggregate.model.SourceType;
import com.delta.digest.config.DigestProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class ImageCandidateExtractorTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ImageCandidateExtractor extractor;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        DigestProperties properties = new DigestProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.getImages().setPaperHtmlBaseUrl(server.url("/html").toString());
        executor = Executors.newFixedThreadPool(1);
        extractor = new ImageCandidateExtractor(new PoliteHttpClient(properties, executor), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = ImageCandidateExtractorTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private Entry entry(SourceType type, String url, Map<String, Object> extra) {
        return new Entry("e1", type, "src", "Title", "", url, null, List.of(), extra);
    }

    @Test
    void readsOpenGraphImageFromLinkedPage() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/html; charset=utf-8").setBody(fixture("og-page.html")));

        List<ImageReference> images = extractor.extract(entry(SourceType.STRUCTURED_API, server.url("/story").toString(), Map.of()));

        assertThat(images).hasSize(1);
        assertThat(images.get(0).url()).isEqualTo(server.url("/media/cover.jpg").toString());
        assertThat(images.get(0).kind()).isEqualTo(ImageReference.KIND_OG_IMAGE);
        assertThat(images.get(0).sequence()).isZero();
    }

    @Test
    void dataUriOpenGraphImageIsRejected() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/html")
            .setBody("<html><head><meta property=\"og:image\" content=\"data:image/png;base64,AAAA\"></head></html>"));

        List<ImageReference> images = extractor.extract(entry(SourceType.STRUCTURED_API, server.url("/story").toString(), Map.of()));

        assertThat(images).isEmpty();
    }

    @Test
    void failedPageFetchDegradesToNoCandidates() {
        server.enqueue(new MockResponse().setResponseCode(404));

        List<ImageReference> images = extractor.extract(entry(SourceType.STRUCTURED_API, server.url("/missing").toString(), Map.of()));

        assertThat(images).isEmpty();
    }

    @Test
    void paperFiguresSkipFormulasIconsDataUrisAndSmallImagesUpToTheCap() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/html").setBody(fixture("arxiv-paper.html")));
        Entry paper = entry(SourceType.SCHOLARLY_LISTING, "https://arxiv.org/abs/2405.01234",
            Map.of(Entry.EXTRA_ARXIV_ID, "2405.01234"));

        List<ImageReference> images = extractor.extract(paper);

        String base = server.url("/html/2405.01234/").toString();
        assertThat(images).extracting(ImageReference::url).containsExactly(
            base + "x1.png",
            base + "model_architecture.png",
            base + "x2.png",
            base + "unsized_chart.png",
            base + "x3.png"
        );
        assertThat(images).extracting(ImageReference::kind).containsExactly(
            ImageReference.KIND_FIGURE,
            ImageReference.KIND_DIAGRAM,
            ImageReference.KIND_FIGURE,
            ImageReference.KIND_IMAGE,
            ImageReference.KIND_FIGURE
        );
        assertThat(images).extracting(ImageReference::sequence).containsExactly(0, 1, 2, 3, 4);
        assertThat(server.takeRequest().getPath()).isEqualTo("/html/2405.01234/");
    }

    @Test
    void embeddedFeedImagesBecomeEnclosuresWithoutFetching() {
        Entry item = entry(SourceType.SYNDICATION_FEED, "https://news.example.org/a",
            Map.of(Entry.EXTRA_FEED_IMAGES, List.of("data:image/gif;base64,R0lG", "https://cdn.example.org/a.jpg", "not a url")));

        List<ImageReference> images = extractor.extract(item);

        assertThat(images).containsExactly(new ImageReference("https://cdn.example.org/a.jpg", ImageReference.KIND_ENCLOSURE, 0));
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void openGraphStrategyUsesFirstFeedImageAsOgImage() {
        Entry item = entry(SourceType.STRUCTURED_API, "https://news.example.org/b",
            Map.of(Entry.EXTRA_FEED_IMAGES, List.of("https://cdn.example.org/first.jpg", "https://cdn.example.org/second.jpg")));

        List<ImageReference> images = extractor.extract(item, ImageStrategy.OG_IMAGE);

        assertThat(images).containsExactly(new ImageReference("https://cdn.example.org/first.jpg", ImageReference.KIND_OG_IMAGE, 0));
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void noneStrategyAndListingSourcesProduceNothing() {
        Entry item = entry(SourceType.HTML_LISTING, "https://site.example.com/a", Map.of());

        assertThat(extractor.extract(item)).isEmpty();
        assertThat(extractor.extract(item, ImageStrategy.NONE)).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }
}
