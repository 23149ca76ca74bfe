package com.delta.digest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "digest")
public class DigestProperties {
    private static final String DEFAULT_USER_AGENT = "topic-digest/0.1 (+contact)";

    private String userAgent;
    private int globalConcurrency = 6;
    private int perHostConcurrency = 2;
    private int perHostDelayMs = 250;
    private int requestTimeoutSeconds = 10;
    private int sourceConcurrency = 4;
    private int extractionConcurrency = 3;
    private int downloadConcurrency = 4;
    private int maxPageBytes = 2_000_000;
    private Images images = new Images();
    private Output output = new Output();
    private Cli cli = new Cli();
    private List<SourceProperties> sources = new ArrayList<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getSourceConcurrency() {
        return Math.max(1, sourceConcurrency);
    }

    public void setSourceConcurrency(int sourceConcurrency) {
        this.sourceConcurrency = Math.max(1, sourceConcurrency);
    }

    public int getExtractionConcurrency() {
        return Math.max(1, extractionConcurrency);
    }

    public void setExtractionConcurrency(int extractionConcurrency) {
        this.extractionConcurrency = Math.max(1, extractionConcurrency);
    }

    public int getDownloadConcurrency() {
        return Math.max(1, downloadConcurrency);
    }

    public void setDownloadConcurrency(int downloadConcurrency) {
        this.downloadConcurrency = Math.max(1, downloadConcurrency);
    }

    public int getMaxPageBytes() {
        return Math.max(1024, maxPageBytes);
    }

    public void setMaxPageBytes(int maxPageBytes) {
        this.maxPageBytes = maxPageBytes;
    }

    public Images getImages() {
        return images;
    }

    public void setImages(Images images) {
        this.images = images;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public List<SourceProperties> getSources() {
        return sources;
    }

    public void setSources(List<SourceProperties> sources) {
        this.sources = sources == null ? new ArrayList<>() : sources;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Images {
        private String outputDir = "./images";
        private int maxFiguresPerEntry = 5;
        private int minFigureDimension = 200;
        private int maxImageBytes = 10 * 1024 * 1024;
        private String paperHtmlBaseUrl = "https://arxiv.org/html";

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }

        public int getMaxFiguresPerEntry() {
            return Math.max(1, maxFiguresPerEntry);
        }

        public void setMaxFiguresPerEntry(int maxFiguresPerEntry) {
            this.maxFiguresPerEntry = Math.max(1, maxFiguresPerEntry);
        }

        public int getMinFigureDimension() {
            return Math.max(0, minFigureDimension);
        }

        public void setMinFigureDimension(int minFigureDimension) {
            this.minFigureDimension = Math.max(0, minFigureDimension);
        }

        public int getMaxImageBytes() {
            return Math.max(1, maxImageBytes);
        }

        public void setMaxImageBytes(int maxImageBytes) {
            this.maxImageBytes = Math.max(1, maxImageBytes);
        }

        public String getPaperHtmlBaseUrl() {
            return paperHtmlBaseUrl;
        }

        public void setPaperHtmlBaseUrl(String paperHtmlBaseUrl) {
            this.paperHtmlBaseUrl = paperHtmlBaseUrl;
        }
    }

    public static class Output {
        private String path = "ai_daily_news.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean downloadImages;
        private boolean exitAfterRun = true;
        private String date;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isDownloadImages() {
            return downloadImages;
        }

        public void setDownloadImages(boolean downloadImages) {
            this.downloadImages = downloadImages;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public String getDate() {
            return date;
        }

        public void setDate(String date) {
            this.date = date;
        }
    }

    /**
     * Raw, unvalidated description of one source as bound from configuration.
     */
    public static class SourceProperties {
        private String key;
        private String type;
        private boolean enabled = true;
        private String url;
        private List<String> keywords = new ArrayList<>();
        private Integer limit;
        private Integer fetchSize;
        private Integer priority;
        private String date;
        private String dateFrom;
        private String dateTo;
        private Integer maxAgeDays;
        private String sort;
        private String images;
        private boolean followTargetDate = true;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords == null ? new ArrayList<>() : keywords;
        }

        public Integer getLimit() {
            return limit;
        }

        public void setLimit(Integer limit) {
            this.limit = limit;
        }

        public Integer getFetchSize() {
            return fetchSize;
        }

        public void setFetchSize(Integer fetchSize) {
            this.fetchSize = fetchSize;
        }

        public Integer getPriority() {
            return priority;
        }

        public void setPriority(Integer priority) {
            this.priority = priority;
        }

        public String getDate() {
            return date;
        }

        public void setDate(String date) {
            this.date = date;
        }

        public String getDateFrom() {
            return dateFrom;
        }

        public void setDateFrom(String dateFrom) {
            this.dateFrom = dateFrom;
        }

        public String getDateTo() {
            return dateTo;
        }

        public void setDateTo(String dateTo) {
            this.dateTo = dateTo;
        }

        public Integer getMaxAgeDays() {
            return maxAgeDays;
        }

        public void setMaxAgeDays(Integer maxAgeDays) {
            this.maxAgeDays = maxAgeDays;
        }

        public String getSort() {
            return sort;
        }

        public void setSort(String sort) {
            this.sort = sort;
        }

        public String getImages() {
            return images;
        }

        public void setImages(String images) {
            this.images = images;
        }

        public boolean isFollowTargetDate() {
            return followTargetDate;
        }

        public void setFollowTargetDate(boolean followTargetDate) {
            this.followTargetDate = followTargetDate;
        }
    }
}
