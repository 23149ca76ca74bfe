package com.delta.digest.aggregate.service;

import com.delta.digest.aggregate.model.DateRange;
import com.delta.digest.aggregate.model.ImageStrategy;
import com.delta.digest.aggregate.model.SortOrder;
import com.delta.digest.aggregate.model.SourceConfig;
import com.delta.digest.aggregate.model.SourceType;
import com.delta.digest.aggregate.util.UrlUtils;
import com.delta.digest.config.DigestProperties.SourceProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Validates raw source properties into immutable {@link SourceConfig} values.
 * <p>
 * Date precedence: {@code date} or {@code date-from}/{@code date-to} on the source, then the run's target
 * date (unless the source opts out), then {@code max-age-days}.
 */
@Component
public class SourceConfigFactory {
    static final int MAX_FETCH_SIZE = 1000;

    private final Clock clock;

    public SourceConfigFactory() {
        this(Clock.systemUTC());
    }

    SourceConfigFactory(Clock clock) {
        this.clock = clock;
    }

    public SourceConfig create(SourceProperties raw, int index, LocalDate targetDate) {
        SourceType type = SourceType.fromCode(raw.getType());
        String key = raw.getKey() == null || raw.getKey().isBlank()
            ? (type == null ? "source-" + index : type.code() + "-" + index)
            : raw.getKey().trim();
        if (type == null) {
            throw new InvalidSourceConfigException(key, "unknown source type '" + raw.getType() + "'");
        }

        String url = raw.getUrl() == null || raw.getUrl().isBlank() ? null : raw.getUrl().trim();
        if (url == null && type.requiresUrl()) {
            throw new InvalidSourceConfigException(key, "source type " + type.code() + " requires a url");
        }
        if (url != null && !UrlUtils.isHttpUrl(url)) {
            throw new InvalidSourceConfigException(key, "url '" + url + "' is not an absolute http(s) URL");
        }

        int limit = raw.getLimit() == null ? defaultLimit(type) : raw.getLimit();
        if (limit <= 0) {
            throw new InvalidSourceConfigException(key, "limit must be positive, got " + limit);
        }
        int fetchSize = raw.getFetchSize() == null ? defaultFetchSize(type, limit) : raw.getFetchSize();
        if (fetchSize <= 0) {
            throw new InvalidSourceConfigException(key, "fetch-size must be positive, got " + fetchSize);
        }
        fetchSize = Math.min(MAX_FETCH_SIZE, Math.max(limit, fetchSize));

        SortOrder sort = SortOrder.fromCode(raw.getSort());
        if (sort == null) {
            throw new InvalidSourceConfigException(key, "unknown sort '" + raw.getSort() + "'");
        }
        ImageStrategy images = null;
        if (raw.getImages() != null && !raw.getImages().isBlank()) {
            images = ImageStrategy.fromCode(raw.getImages());
            if (images == null) {
                throw new InvalidSourceConfigException(key, "unknown image strategy '" + raw.getImages() + "'");
            }
        }

        DateRange range = dateRange(key, raw, targetDate);
        if (!type.supportsDateRange()) {
            range = null;
        }
        int priority = raw.getPriority() == null ? index : raw.getPriority();
        List<String> keywords = raw.getKeywords().stream()
            .filter(keyword -> keyword != null && !keyword.isBlank())
            .map(String::trim)
            .toList();
        return new SourceConfig(key, type, url, keywords, limit, fetchSize, priority, range, sort, images);
    }

    public static LocalDate parseTargetDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidSourceConfigException("run", "target date '" + raw + "' is not YYYY-MM-DD", e);
        }
    }

    private DateRange dateRange(String key, SourceProperties raw, LocalDate targetDate) {
        boolean hasDay = raw.getDate() != null && !raw.getDate().isBlank();
        boolean hasRange = (raw.getDateFrom() != null && !raw.getDateFrom().isBlank())
            || (raw.getDateTo() != null && !raw.getDateTo().isBlank());
        if (hasDay && hasRange) {
            throw new InvalidSourceConfigException(key, "date cannot be combined with date-from/date-to");
        }
        if (hasDay) {
            return DateRange.ofDay(parseDay(key, "date", raw.getDate()));
        }
        if (hasRange) {
            Instant start = parseBound(key, "date-from", raw.getDateFrom(), false);
            Instant end = parseBound(key, "date-to", raw.getDateTo(), true);
            if (start != null && end != null && start.isAfter(end)) {
                throw new InvalidSourceConfigException(key, "date-from is after date-to");
            }
            return new DateRange(start, end);
        }
        if (targetDate != null && raw.isFollowTargetDate()) {
            return DateRange.ofDay(targetDate);
        }
        Integer maxAgeDays = raw.getMaxAgeDays();
        if (maxAgeDays != null) {
            if (maxAgeDays < 0) {
                throw new InvalidSourceConfigException(key, "max-age-days must not be negative");
            }
            if (maxAgeDays > 0) {
                Instant now = clock.instant();
                return new DateRange(now.minus(Duration.ofDays(maxAgeDays)), now);
            }
        }
        return null;
    }

    private LocalDate parseDay(String key, String field, String raw) {
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidSourceConfigException(key, field + " '" + raw + "' is not YYYY-MM-DD", e);
        }
    }

    /**
     * Accepts a full timestamp or a bare day; a bare day as the upper bound covers the whole day.
     */
    private Instant parseBound(String key, String field, String raw, boolean upper) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (value.length() > 10) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException e) {
                throw new InvalidSourceConfigException(key, field + " '" + raw + "' is not an ISO-8601 timestamp", e);
            }
        }
        LocalDate day = parseDay(key, field, value);
        return upper ? DateRange.ofDay(day).end() : day.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private int defaultLimit(SourceType type) {
        return switch (type) {
            case STRUCTURED_API -> 8;
            case SCHOLARLY_LISTING -> 2;
            default -> 10;
        };
    }

    private int defaultFetchSize(SourceType type, int limit) {
        return switch (type) {
            case STRUCTURED_API -> (int) Math.min(MAX_FETCH_SIZE, limit * 20L);
            case SCHOLARLY_LISTING -> Math.max(20, limit);
            default -> Math.max(limit, 100);
        };
    }
}
