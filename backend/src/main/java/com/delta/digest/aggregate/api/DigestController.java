package com.delta.digest.aggregate.api;

import com.delta.digest.aggregate.download.BatchImageDownloader;
import com.delta.digest.aggregate.model.AggregationResult;
import com.delta.digest.aggregate.model.DigestDocument;
import com.delta.digest.aggregate.model.DownloadReport;
import com.delta.digest.aggregate.service.AggregatorService;
import com.delta.digest.aggregate.service.SourceConfigFactory;
import com.delta.digest.config.DigestProperties;
import com.delta.digest.config.DigestProperties.SourceProperties;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/digest")
public class DigestController {
    private final AggregatorService aggregatorService;
    private final BatchImageDownloader imageDownloader;
    private final SourceConfigFactory sourceConfigFactory;
    private final DigestProperties properties;

    public DigestController(
        AggregatorService aggregatorService,
        BatchImageDownloader imageDownloader,
        SourceConfigFactory sourceConfigFactory,
        DigestProperties properties
    ) {
        this.aggregatorService = aggregatorService;
        this.imageDownloader = imageDownloader;
        this.sourceConfigFactory = sourceConfigFactory;
        this.properties = properties;
    }

    @PostMapping("/run")
    public DigestDocument run(@RequestBody(required = false) DigestApiRunRequest request) {
        LocalDate targetDate = SourceConfigFactory.parseTargetDate(request == null ? null : request.date());
        List<SourceProperties> sources = request == null || request.sources() == null || request.sources().isEmpty()
            ? properties.getSources()
            : request.sources();
        if (request != null && request.sources() != null) {
            // caller-supplied sources must all validate
            for (int i = 0; i < request.sources().size(); i++) {
                sourceConfigFactory.create(request.sources().get(i), i, targetDate);
            }
        }
        AggregationResult result = aggregatorService.aggregate(sources, targetDate);
        DownloadReport downloads = null;
        if (request != null && Boolean.TRUE.equals(request.downloadImages())) {
            downloads = imageDownloader.downloadAll(result.entries());
        }
        LocalDate reportDate = targetDate != null ? targetDate : LocalDate.now(ZoneOffset.UTC);
        return DigestDocument.of(reportDate, result, downloads);
    }

    @PostMapping("/images")
    public DownloadReport downloadImages(@RequestBody DigestApiImagesRequest request) {
        if (request == null || request.entries() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "entries are required");
        }
        return imageDownloader.downloadAll(request.entries());
    }
}
