package com.delta.digest.aggregate.service;

import com.delta.digest.aggregate.media.ImageCandidateExtractor;
import com.delta.digest.aggregate.model.AggregationResult;
import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.ImageReference;
import com.delta.digest.aggregate.model.SortOrder;
import com.delta.digest.aggregate.model.SourceConfig;
import com.delta.digest.aggregate.model.SourceFetchResult;
import com.delta.digest.aggregate.model.SourceReport;
import com.delta.digest.aggregate.model.SourceStatus;
import com.delta.digest.aggregate.model.SourceType;
import com.delta.digest.aggregate.source.SourceAdapterRegistry;
import com.delta.digest.config.DigestProperties;
import com.delta.digest.config.DigestProperties.SourceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs every configured source and merges the results into one ordered, de-duplicated entry list.
 * <p>
 * Per source: fetch, date filter, optional stable sort, truncate to the source limit, then image
 * extraction. Sources are merged by (priority, configuration order) and the first occurrence of an id wins.
 */
@Service
public class AggregatorService {
    private static final Logger log = LoggerFactory.getLogger(AggregatorService.class);

    private final DigestProperties properties;
    private final SourceConfigFactory sourceConfigFactory;
    private final SourceAdapterRegistry adapterRegistry;
    private final ImageCandidateExtractor imageExtractor;
    private final ExecutorService sourceExecutor;
    private final ExecutorService extractionExecutor;

    public AggregatorService(
        DigestProperties properties,
        SourceConfigFactory sourceConfigFactory,
        SourceAdapterRegistry adapterRegistry,
        ImageCandidateExtractor imageExtractor,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor,
        @Qualifier("extractionExecutor") ExecutorService extractionExecutor
    ) {
        this.properties = properties;
        this.sourceConfigFactory = sourceConfigFactory;
        this.adapterRegistry = adapterRegistry;
        this.imageExtractor = imageExtractor;
        this.sourceExecutor = sourceExecutor;
        this.extractionExecutor = extractionExecutor;
    }

    public AggregationResult aggregate(LocalDate targetDate) {
        return aggregate(properties.getSources(), targetDate);
    }

    /**
     * Sources that fail validation are reported {@code CONFIG_INVALID} and skipped; the rest still run.
     */
    public AggregationResult aggregate(List<SourceProperties> sources, LocalDate targetDate) {
        List<SourceConfig> configs = new ArrayList<>();
        List<SourceReport> invalid = new ArrayList<>();
        List<SourceProperties> raw = sources == null ? List.of() : sources;
        for (int i = 0; i < raw.size(); i++) {
            SourceProperties source = raw.get(i);
            if (!source.isEnabled()) {
                continue;
            }
            try {
                configs.add(sourceConfigFactory.create(source, i, targetDate));
            } catch (InvalidSourceConfigException e) {
                log.warn("Source {} has invalid configuration: {}", e.getSourceKey(), e.getMessage());
                invalid.add(SourceReport.configInvalid(e.getSourceKey(), SourceType.fromCode(source.getType()), e.getMessage()));
            }
        }
        AggregationResult result = aggregateConfigs(configs);
        if (invalid.isEmpty()) {
            return result;
        }
        List<SourceReport> reports = new ArrayList<>(result.sources());
        reports.addAll(invalid);
        return new AggregationResult(result.startedAt(), result.finishedAt(), result.entries(), reports);
    }

    public AggregationResult aggregateConfigs(List<SourceConfig> configs) {
        Instant startedAt = Instant.now();
        if (configs == null || configs.isEmpty()) {
            return new AggregationResult(startedAt, Instant.now(), List.of(), List.of());
        }

        List<CompletableFuture<SourceRun>> futures = new ArrayList<>();
        for (SourceConfig config : configs) {
            futures.add(CompletableFuture.supplyAsync(() -> runSource(config), sourceExecutor));
        }
        // barrier: every source has completed or failed before merging
        List<SourceRun> runs = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            SourceConfig config = configs.get(i);
            try {
                runs.add(futures.get(i).join().withOrder(i));
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Source {} aborted: {}", config.key(), cause.toString());
                runs.add(new SourceRun(config, i, SourceFetchResult.failed("source_error"), List.of()));
            }
        }

        List<SourceRun> ordered = new ArrayList<>(runs);
        ordered.sort(Comparator.comparingInt((SourceRun run) -> run.config().priority()).thenComparingInt(SourceRun::order));

        Set<String> seenIds = new HashSet<>();
        List<Entry> merged = new ArrayList<>();
        Map<Integer, Integer> keptByOrder = new HashMap<>();
        for (SourceRun run : ordered) {
            int kept = 0;
            for (Entry entry : run.entries()) {
                if (!seenIds.add(entry.id())) {
                    log.debug("Dropping duplicate {} from {}", entry.url(), run.config().key());
                    continue;
                }
                merged.add(entry);
                kept++;
            }
            keptByOrder.put(run.order(), kept);
        }

        List<SourceReport> reports = new ArrayList<>();
        for (SourceRun run : ordered) {
            SourceReport report = report(run, keptByOrder.getOrDefault(run.order(), 0));
            reports.add(report);
            log.info(
                "Source {} ({}): status={}, fetched={}, kept={}, errors={}",
                report.key(),
                run.config().type().code(),
                report.status(),
                report.fetchedCount(),
                report.keptCount(),
                report.errors()
            );
        }
        log.info("Aggregation finished with {} entries from {} sources", merged.size(), configs.size());
        return new AggregationResult(startedAt, Instant.now(), merged, reports);
    }

    SourceRun runSource(SourceConfig config) {
        SourceFetchResult fetch;
        try {
            fetch = adapterRegistry.forType(config.type()).fetch(config);
        } catch (RuntimeException e) {
            log.warn("Source {} adapter error: {}", config.key(), e.toString());
            fetch = SourceFetchResult.failed("adapter_error");
        }
        if (!fetch.successfulFetch()) {
            return new SourceRun(config, 0, fetch, List.of());
        }

        List<Entry> entries = new ArrayList<>();
        for (Entry entry : fetch.entries()) {
            if (config.type().supportsDateRange() && config.dateRange() != null
                && !config.dateRange().contains(entry.publishedAt())) {
                continue;
            }
            entries.add(entry);
        }
        sort(entries, config.sort());
        if (entries.size() > config.limit()) {
            entries = new ArrayList<>(entries.subList(0, config.limit()));
        }
        return new SourceRun(config, 0, fetch, withImages(config, entries));
    }

    static void sort(List<Entry> entries, SortOrder order) {
        if (order == SortOrder.SCORE) {
            entries.sort(Comparator.comparing(Entry::score, Comparator.nullsLast(Comparator.<Double>reverseOrder())));
        } else if (order == SortOrder.RECENCY) {
            entries.sort(Comparator.comparing(Entry::publishedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        }
    }

    private List<Entry> withImages(SourceConfig config, List<Entry> entries) {
        List<CompletableFuture<List<ImageReference>>> futures = new ArrayList<>();
        for (Entry entry : entries) {
            futures.add(CompletableFuture.supplyAsync(
                () -> imageExtractor.extract(entry, config.imageStrategy()),
                extractionExecutor
            ));
        }
        List<Entry> enriched = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            try {
                enriched.add(entry.withImageCandidates(futures.get(i).join()));
            } catch (CompletionException e) {
                log.debug("Image extraction failed for {}: {}", entry.url(), e.getMessage());
                enriched.add(entry.withImageCandidates(List.of()));
            }
        }
        return enriched;
    }

    private SourceReport report(SourceRun run, int kept) {
        SourceStatus status;
        if (!run.fetch().successfulFetch()) {
            status = SourceStatus.FAILED;
        } else if (kept == 0) {
            status = SourceStatus.EMPTY;
        } else {
            status = SourceStatus.OK;
        }
        Map<String, Integer> errors = new LinkedHashMap<>(run.fetch().errors());
        return new SourceReport(
            run.config().key(),
            run.config().type(),
            status,
            run.fetch().entries().size(),
            kept,
            errors
        );
    }

    record SourceRun(SourceConfig config, int order, SourceFetchResult fetch, List<Entry> entries) {
        SourceRun withOrder(int position) {
            return new SourceRun(config, position, fetch, entries);
        }
    }
}
