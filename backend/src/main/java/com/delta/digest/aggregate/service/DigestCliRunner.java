package com.delta.digest.aggregate.service;

import com.delta.digest.aggregate.download.BatchImageDownloader;
import com.delta.digest.aggregate.model.AggregationResult;
import com.delta.digest.aggregate.model.DigestDocument;
import com.delta.digest.aggregate.model.DownloadOutcome;
import com.delta.digest.aggregate.model.DownloadReport;
import com.delta.digest.config.DigestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * One-shot run driven by {@code digest.cli.*}: aggregate, optionally download images, write the JSON file.
 */
@Component
public class DigestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DigestCliRunner.class);

    private final DigestProperties properties;
    private final AggregatorService aggregatorService;
    private final BatchImageDownloader imageDownloader;
    private final DigestReportWriter reportWriter;
    private final ConfigurableApplicationContext applicationContext;

    public DigestCliRunner(
        DigestProperties properties,
        AggregatorService aggregatorService,
        BatchImageDownloader imageDownloader,
        DigestReportWriter reportWriter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.aggregatorService = aggregatorService;
        this.imageDownloader = imageDownloader;
        this.reportWriter = reportWriter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        int exitCode = runOnce();
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int runOnce() {
        LocalDate targetDate;
        try {
            targetDate = SourceConfigFactory.parseTargetDate(properties.getCli().getDate());
        } catch (InvalidSourceConfigException e) {
            log.error("Invalid run configuration: {}", e.getMessage());
            return 2;
        }

        AggregationResult result = aggregatorService.aggregate(targetDate);
        DownloadReport downloads = null;
        if (properties.getCli().isDownloadImages()) {
            downloads = imageDownloader.downloadAll(result.entries());
            log.info(
                "Images: downloaded={}, present={}, failed={}",
                downloads.count(DownloadOutcome.DOWNLOADED),
                downloads.count(DownloadOutcome.ALREADY_PRESENT),
                downloads.count(DownloadOutcome.FAILED)
            );
        }

        LocalDate reportDate = targetDate != null ? targetDate : LocalDate.now(ZoneOffset.UTC);
        DigestDocument document = DigestDocument.of(reportDate, result, downloads);
        try {
            reportWriter.write(document, Paths.get(properties.getOutput().getPath()));
        } catch (IOException e) {
            log.error("Could not write digest to {}", properties.getOutput().getPath(), e);
            return 1;
        }
        log.info(
            "Digest run complete: total={}, news={}, papers={}",
            document.stats().total(),
            document.stats().news(),
            document.stats().papers()
        );
        return 0;
    }
}
