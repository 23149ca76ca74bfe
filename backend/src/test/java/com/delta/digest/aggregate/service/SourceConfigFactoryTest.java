package com.delta.digest.aggregate.service;

import com.delta.digest.aggregate.model.DateRange;
import com.delta.digest.aggregate.model.ImageStrategy;
import com.delta.digest.aggregate.model.SortOrder;
import com.delta.digest.aggregate.model.SourceConfig;
import com.delta.digest.aggregate.model.SourceType;
import com.delta.digest.config.DigestProperties.SourceProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceConfigFactoryTest {
    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private final SourceConfigFactory factory = new SourceConfigFactory(Clock.fixed(NOW, ZoneOffset.UTC));

    private static SourceProperties source(String key, String type) {
        SourceProperties raw = new SourceProperties();
        raw.setKey(key);
        raw.setType(type);
        return raw;
    }

    @Test
    void appliesTypeDefaults() {
        SourceConfig hn = factory.create(source("hn", "structured-api"), 0, null);
        SourceConfig arxiv = factory.create(source("arxiv", "scholarly-listing"), 1, null);

        assertThat(hn.limit()).isEqualTo(8);
        assertThat(hn.fetchSize()).isEqualTo(160);
        assertThat(hn.priority()).isZero();
        assertThat(hn.sort()).isEqualTo(SortOrder.NATIVE);
        assertThat(hn.imageStrategy()).isEqualTo(ImageStrategy.OG_IMAGE);
        assertThat(hn.dateRange()).isNull();
        assertThat(arxiv.limit()).isEqualTo(2);
        assertThat(arxiv.fetchSize()).isEqualTo(20);
        assertThat(arxiv.priority()).isEqualTo(1);
        assertThat(arxiv.imageStrategy()).isEqualTo(ImageStrategy.PAPER_FIGURES);
    }

    @Test
    void fetchSizeIsClampedBetweenLimitAndCeiling() {
        SourceProperties small = source("feed", "syndication-feed");
        small.setUrl("https://example.com/rss");
        small.setLimit(10);
        small.setFetchSize(3);
        SourceProperties huge = source("hn", "structured-api");
        huge.setFetchSize(50_000);

        assertThat(factory.create(small, 0, null).fetchSize()).isEqualTo(10);
        assertThat(factory.create(huge, 0, null).fetchSize()).isEqualTo(SourceConfigFactory.MAX_FETCH_SIZE);
    }

    @Test
    void keywordsAreTrimmedAndBlanksDropped() {
        SourceProperties raw = source("hn", "structured-api");
        raw.setKeywords(List.of(" AI ", "", "LLM"));

        assertThat(factory.create(raw, 0, null).keywords()).containsExactly("AI", "LLM");
    }

    @Test
    void rejectsInvalidValues() {
        SourceProperties noUrl = source("feed", "syndication-feed");
        SourceProperties badUrl = source("custom", "custom-feed");
        badUrl.setUrl("ftp://example.com/feed");
        SourceProperties zeroLimit = source("hn", "structured-api");
        zeroLimit.setLimit(0);
        SourceProperties badSort = source("hn", "structured-api");
        badSort.setSort("popularity");
        SourceProperties badImages = source("hn", "structured-api");
        badImages.setImages("thumbnails");
        SourceProperties unknownType = source("mystery", "podcast");

        assertThatThrownBy(() -> factory.create(noUrl, 0, null))
            .isInstanceOf(InvalidSourceConfigException.class)
            .hasMessageContaining("requires a url");
        assertThatThrownBy(() -> factory.create(badUrl, 0, null)).isInstanceOf(InvalidSourceConfigException.class);
        assertThatThrownBy(() -> factory.create(zeroLimit, 0, null)).hasMessageContaining("limit");
        assertThatThrownBy(() -> factory.create(badSort, 0, null)).hasMessageContaining("sort");
        assertThatThrownBy(() -> factory.create(badImages, 0, null)).hasMessageContaining("image strategy");
        assertThatThrownBy(() -> factory.create(unknownType, 0, null))
            .isInstanceOfSatisfying(InvalidSourceConfigException.class,
                e -> assertThat(e.getSourceKey()).isEqualTo("mystery"));
    }

    @Test
    void explicitDayWinsOverTargetDate() {
        SourceProperties raw = source("hn", "structured-api");
        raw.setDate("2024-05-01");

        SourceConfig config = factory.create(raw, 0, LocalDate.of(2024, 6, 1));

        assertThat(config.dateRange()).isEqualTo(DateRange.ofDay(LocalDate.of(2024, 5, 1)));
    }

    @Test
    void dayBoundsCoverWholeDays() {
        SourceProperties raw = source("hn", "structured-api");
        raw.setDateFrom("2024-05-01");
        raw.setDateTo("2024-05-03");

        DateRange range = factory.create(raw, 0, null).dateRange();

        assertThat(range.start()).isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
        assertThat(range.contains(Instant.parse("2024-05-03T23:59:59Z"))).isTrue();
        assertThat(range.contains(Instant.parse("2024-05-04T00:00:00Z"))).isFalse();
    }

    @Test
    void acceptsTimestampBoundsAndOpenEnds() {
        SourceProperties raw = source("hn", "structured-api");
        raw.setDateFrom("2024-05-01T08:00:00+02:00");

        DateRange range = factory.create(raw, 0, null).dateRange();

        assertThat(range.start()).isEqualTo(Instant.parse("2024-05-01T06:00:00Z"));
        assertThat(range.end()).isNull();
    }

    @Test
    void rejectsConflictingOrInvertedDates() {
        SourceProperties both = source("hn", "structured-api");
        both.setDate("2024-05-01");
        both.setDateFrom("2024-04-01");
        SourceProperties inverted = source("hn", "structured-api");
        inverted.setDateFrom("2024-05-02");
        inverted.setDateTo("2024-05-01");
        SourceProperties garbage = source("hn", "structured-api");
        garbage.setDate("yesterday");

        assertThatThrownBy(() -> factory.create(both, 0, null)).hasMessageContaining("cannot be combined");
        assertThatThrownBy(() -> factory.create(inverted, 0, null)).hasMessageContaining("after");
        assertThatThrownBy(() -> factory.create(garbage, 0, null)).isInstanceOf(InvalidSourceConfigException.class);
    }

    @Test
    void targetDateAppliesUnlessSourceOptsOut() {
        SourceProperties follows = source("arxiv", "scholarly-listing");
        follows.setMaxAgeDays(30);
        SourceProperties optsOut = source("hn", "structured-api");
        optsOut.setMaxAgeDays(7);
        optsOut.setFollowTargetDate(false);
        LocalDate target = LocalDate.of(2024, 6, 10);

        assertThat(factory.create(follows, 0, target).dateRange()).isEqualTo(DateRange.ofDay(target));
        DateRange window = factory.create(optsOut, 1, target).dateRange();
        assertThat(window.start()).isEqualTo(Instant.parse("2024-06-08T12:00:00Z"));
        assertThat(window.end()).isEqualTo(NOW);
    }

    @Test
    void zeroMaxAgeMeansNoWindowAndNegativeIsRejected() {
        SourceProperties none = source("hn", "structured-api");
        none.setMaxAgeDays(0);
        SourceProperties negative = source("hn", "structured-api");
        negative.setMaxAgeDays(-1);

        assertThat(factory.create(none, 0, null).dateRange()).isNull();
        assertThatThrownBy(() -> factory.create(negative, 0, null)).hasMessageContaining("max-age-days");
    }

    @Test
    void listingSourcesIgnoreDateSettings() {
        SourceProperties raw = source("news-site", "html-listing");
        raw.setUrl("https://news.example.com/");
        raw.setDate("2024-05-01");

        SourceConfig config = factory.create(raw, 3, LocalDate.of(2024, 6, 1));

        assertThat(config.type()).isEqualTo(SourceType.HTML_LISTING);
        assertThat(config.dateRange()).isNull();
        assertThat(config.priority()).isEqualTo(3);
    }

    @Test
    void parsesRunDate() {
        assertThat(SourceConfigFactory.parseTargetDate(" 2024-05-01 ")).isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(SourceConfigFactory.parseTargetDate("")).isNull();
        assertThatThrownBy(() -> SourceConfigFactory.parseTargetDate("05/01/2024"))
            .isInstanceOfSatisfying(InvalidSourceConfigException.class,
                e -> assertThat(e.getSourceKey()).isEqualTo("run"));
    }
}
