package com.delta.digest.aggregate.source;

import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.SourceConfig;
import com.delta.digest.aggregate.model.SourceFetchResult;
import com.delta.digest.aggregate.model.SourceType;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ArxivAdapterTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ArxivAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        adapter = new ArxivAdapter(SourceTestSupport.httpClient(executor), new FeedParser());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void mapsPapersWithVersionlessIdsAndTruncatedSummaries() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/atom+xml")
            .setBody(SourceTestSupport.fixture("arxiv-atom.xml")));
        SourceConfig config = SourceTestSupport.config(
            "arxiv", SourceType.SCHOLARLY_LISTING, server.url("/api/query").toString(), List.of("machine learning"), 2, 20);

        SourceFetchResult result = adapter.fetch(config);

        assertThat(result.entries()).hasSize(2);
        Entry paper = result.entries().get(0);
        assertThat(paper.url()).isEqualTo("https://arxiv.org/abs/2405.01234");
        assertThat(paper.extra()).containsEntry(Entry.EXTRA_ARXIV_ID, "2405.01234");
        assertThat(paper.extra().get(Entry.EXTRA_AUTHORS)).isEqualTo(List.of("Erin Zhao", "Frank Li"));
        assertThat(paper.title()).isEqualTo("Sparse Mixture of Experts for Vision Transformers");
        assertThat(paper.summary()).endsWith("...").hasSizeLessThanOrEqualTo(303).doesNotContain("\n");
        assertThat(paper.publishedAt()).isEqualTo(Instant.parse("2024-05-02T17:59:59Z"));
        assertThat(paper.contentKind()).isEqualTo("paper");
        assertThat(result.entries().get(1).url()).isEqualTo("https://arxiv.org/abs/2405.05678");
        assertThat(result.entries().get(1).summary()).isEqualTo("Brief.");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        String query = URLDecoder.decode(request.getPath(), StandardCharsets.UTF_8);
        assertThat(query).contains("search_query=all:machine learning")
            .contains("max_results=20")
            .contains("sortBy=submittedDate");
    }

    @Test
    void extractsIdFromAbsLinks() {
        assertThat(ArxivAdapter.arxivId("http://arxiv.org/abs/2401.00001v3")).isEqualTo("2401.00001");
        assertThat(ArxivAdapter.arxivId("http://arxiv.org/abs/hep-th/9901001v1")).isEqualTo("hep-th/9901001");
        assertThat(ArxivAdapter.arxivId("https://example.com/paper")).isNull();
    }
}
