package com.delta.digest.aggregate.api;

import com.delta.digest.aggregate.download.BatchImageDownloader;
import com.delta.digest.aggregate.model.AggregationResult;
import com.delta.digest.aggregate.model.DigestDocument;
import com.delta.digest.aggregate.model.DownloadReport;
import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.SourceType;
import com.delta.digest.aggregate.service.AggregatorService;
import com.delta.digest.aggregate.service.InvalidSourceConfigException;
import com.delta.digest.aggregate.service.SourceConfigFactory;
import com.delta.digest.config.DigestProperties;
import com.delta.digest.config.DigestProperties.SourceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DigestControllerTest {

    @Mock
    private AggregatorService aggregatorService;
    @Mock
    private BatchImageDownloader imageDownloader;

    private DigestProperties properties;
    private DigestController controller;

    @BeforeEach
    void setUp() {
        properties = new DigestProperties();
        SourceProperties configured = new SourceProperties();
        configured.setKey("hackernews");
        configured.setType("structured-api");
        properties.setSources(List.of(configured));
        controller = new DigestController(aggregatorService, imageDownloader, new SourceConfigFactory(), properties);
    }

    private static Entry entry(SourceType type, String url) {
        return new Entry(Integer.toHexString(url.hashCode()), type, type.code(), "t", "", url, null, List.of(), Map.of());
    }

    @Test
    void runUsesConfiguredSourcesAndRequestedDate() {
        AggregationResult result = new AggregationResult(Instant.now(), Instant.now(), List.of(
            entry(SourceType.STRUCTURED_API, "https://a.example.com/1"),
            entry(SourceType.SCHOLARLY_LISTING, "https://arxiv.org/abs/2401.00001")
        ), List.of());
        when(aggregatorService.aggregate(anyList(), eq(LocalDate.of(2024, 5, 1)))).thenReturn(result);

        DigestDocument document = controller.run(new DigestApiRunRequest("2024-05-01", null, null));

        ArgumentCaptor<List<SourceProperties>> captor = ArgumentCaptor.forClass(List.class);
        verify(aggregatorService).aggregate(captor.capture(), any());
        assertEquals("hackernews", captor.getValue().get(0).getKey());
        assertEquals(LocalDate.of(2024, 5, 1), document.date());
        assertEquals(2, document.stats().total());
        assertEquals(1, document.stats().news());
        assertEquals(1, document.stats().papers());
        assertNull(document.downloads());
        verifyNoInteractions(imageDownloader);
    }

    @Test
    void runDownloadsImagesWhenAsked() {
        Entry entry = entry(SourceType.SYNDICATION_FEED, "https://blog.example.com/post");
        AggregationResult result = new AggregationResult(Instant.now(), Instant.now(), List.of(entry), List.of());
        when(aggregatorService.aggregate(anyList(), any())).thenReturn(result);
        when(imageDownloader.downloadAll(List.of(entry))).thenReturn(new DownloadReport(List.of(entry), List.of()));

        DigestDocument document = controller.run(new DigestApiRunRequest(null, null, true));

        assertEquals(List.of(), document.downloads());
        verify(imageDownloader).downloadAll(List.of(entry));
    }

    @Test
    void invalidRequestedSourceIsRejectedBeforeAggregating() {
        SourceProperties broken = new SourceProperties();
        broken.setKey("blog");
        broken.setType("syndication-feed");

        InvalidSourceConfigException error = assertThrows(
            InvalidSourceConfigException.class,
            () -> controller.run(new DigestApiRunRequest(null, List.of(broken), false))
        );

        assertEquals("blog", error.getSourceKey());
        verify(aggregatorService, never()).aggregate(anyList(), any());
        ResponseEntity<Map<String, String>> response = new DigestExceptionHandler().handleInvalidSource(error);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("config_invalid", response.getBody().get("error"));
        assertEquals("blog", response.getBody().get("source"));
    }

    @Test
    void malformedDateIsRejected() {
        assertThrows(
            InvalidSourceConfigException.class,
            () -> controller.run(new DigestApiRunRequest("01/05/2024", null, false))
        );
        verifyNoInteractions(aggregatorService);
    }

    @Test
    void imagesEndpointRequiresEntries() {
        ResponseStatusException error = assertThrows(
            ResponseStatusException.class,
            () -> controller.downloadImages(new DigestApiImagesRequest(null))
        );
        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
    }
}
