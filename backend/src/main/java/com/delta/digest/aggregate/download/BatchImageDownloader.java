package com.delta.digest.aggregate.download;

import com.delta.digest.aggregate.http.PoliteHttpClient;
import com.delta.digest.aggregate.model.DownloadOutcome;
import com.delta.digest.aggregate.model.DownloadReport;
import com.delta.digest.aggregate.model.Entry;
import com.delta.digest.aggregate.model.HttpFetchResult;
import com.delta.digest.aggregate.model.ImageDownloadStatus;
import com.delta.digest.aggregate.model.ImageReference;
import com.delta.digest.aggregate.util.ReasonCodeClassifier;
import com.delta.digest.config.DigestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Downloads every candidate image of every entry into one directory. Single failures are recorded in the
 * report and never abort the batch; files that already exist under their deterministic name are reused.
 */
@Service
public class BatchImageDownloader {
    private static final Logger log = LoggerFactory.getLogger(BatchImageDownloader.class);
    private static final String IMAGE_ACCEPT = "image/avif,image/webp,image/png,image/jpeg,image/*;q=0.8,*/*;q=0.5";

    private final PoliteHttpClient httpClient;
    private final DigestProperties properties;
    private final ExecutorService downloadExecutor;

    public BatchImageDownloader(
        PoliteHttpClient httpClient,
        DigestProperties properties,
        @Qualifier("downloadExecutor") ExecutorService downloadExecutor
    ) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.downloadExecutor = downloadExecutor;
    }

    public DownloadReport downloadAll(List<Entry> entries) {
        return downloadAll(entries, Paths.get(properties.getImages().getOutputDir()));
    }

    public DownloadReport downloadAll(List<Entry> entries, Path outputDir) {
        List<Entry> input = entries == null ? List.of() : entries;
        List<CompletableFuture<ImageDownloadStatus>> futures = new ArrayList<>();
        boolean directoryReady = prepareDirectory(outputDir);
        for (Entry entry : input) {
            for (ImageReference image : entry.imageCandidates()) {
                if (!directoryReady) {
                    futures.add(CompletableFuture.completedFuture(
                        failed(entry, image, ImageFileNames.baseName(entry, image), "write_failed")
                    ));
                    continue;
                }
                futures.add(CompletableFuture.supplyAsync(() -> downloadOne(entry, image, outputDir), downloadExecutor));
            }
        }

        List<ImageDownloadStatus> statuses = new ArrayList<>();
        int index = 0;
        for (Entry entry : input) {
            for (ImageReference image : entry.imageCandidates()) {
                CompletableFuture<ImageDownloadStatus> future = futures.get(index++);
                try {
                    statuses.add(future.join());
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("Image download task failed for {}: {}", image.url(), cause.getMessage());
                    statuses.add(failed(entry, image, ImageFileNames.baseName(entry, image), "download_error"));
                }
            }
        }

        List<Entry> updated = mergeLocalPaths(input, statuses);
        long downloaded = statuses.stream().filter(s -> s.outcome() == DownloadOutcome.DOWNLOADED).count();
        long present = statuses.stream().filter(s -> s.outcome() == DownloadOutcome.ALREADY_PRESENT).count();
        log.info("Image download finished: {} downloaded, {} already present, {} failed",
            downloaded, present, statuses.size() - downloaded - present);
        return new DownloadReport(updated, statuses);
    }

    ImageDownloadStatus downloadOne(Entry entry, ImageReference image, Path outputDir) {
        String baseName = ImageFileNames.baseName(entry, image);
        Path existing = findExisting(outputDir, baseName);
        if (existing != null) {
            return new ImageDownloadStatus(entry.id(), image.sequence(), image.url(), existing.getFileName().toString(),
                existing.toString(), DownloadOutcome.ALREADY_PRESENT, null, null);
        }

        HttpFetchResult result = httpClient.get(image.url(), IMAGE_ACCEPT, properties.getImages().getMaxImageBytes());
        if (!result.isSuccessful()) {
            log.debug("Image {} failed: {}", image.url(), result.errorKey());
            String reasonCode = result.errorCode() != null
                ? ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage())
                : ReasonCodeClassifier.fromHttpStatus(result.statusCode());
            return failed(entry, image, baseName, result.errorKey(), reasonCode);
        }
        String mediaType = result.mediaType();
        if (!mediaType.isEmpty() && !mediaType.startsWith("image/")) {
            log.debug("Image {} served as {}", image.url(), mediaType);
            return failed(entry, image, baseName, "not_image");
        }
        byte[] bytes = result.bodyBytes();
        if (bytes == null || bytes.length == 0) {
            return failed(entry, image, baseName, "empty_body");
        }

        String extension = ImageFileNames.extensionFromUrl(image.url());
        if (extension == null) {
            extension = ImageFileNames.extensionFromMediaType(mediaType);
        }
        if (extension == null) {
            extension = ImageFileNames.DEFAULT_EXTENSION;
        }
        String fileName = baseName + "." + extension;
        Path target = outputDir.resolve(fileName);
        try {
            writeAtomically(outputDir, target, bytes);
        } catch (IOException e) {
            log.warn("Could not write image {} to {}: {}", image.url(), target, e.getMessage());
            return failed(entry, image, baseName, "write_failed");
        }
        return new ImageDownloadStatus(entry.id(), image.sequence(), image.url(), fileName, target.toString(),
            DownloadOutcome.DOWNLOADED, null, null);
    }

    private boolean prepareDirectory(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
            return true;
        } catch (IOException e) {
            log.warn("Image output directory {} is not usable: {}", outputDir, e.getMessage());
            return false;
        }
    }

    private Path findExisting(Path outputDir, String baseName) {
        try (DirectoryStream<Path> matches = Files.newDirectoryStream(outputDir, baseName + ".*")) {
            for (Path match : matches) {
                if (Files.isRegularFile(match) && Files.size(match) > 0 && !match.getFileName().toString().endsWith(".part")) {
                    return match;
                }
            }
        } catch (IOException e) {
            log.debug("Could not list {}: {}", outputDir, e.getMessage());
        }
        return null;
    }

    private void writeAtomically(Path outputDir, Path target, byte[] bytes) throws IOException {
        Path temp = Files.createTempFile(outputDir, target.getFileName().toString() + ".", ".part");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private ImageDownloadStatus failed(Entry entry, ImageReference image, String baseName, String errorKey) {
        return failed(entry, image, baseName, errorKey, ReasonCodeClassifier.fromErrorKey(errorKey));
    }

    private ImageDownloadStatus failed(Entry entry, ImageReference image, String baseName, String errorKey, String reasonCode) {
        return new ImageDownloadStatus(entry.id(), image.sequence(), image.url(), baseName, null,
            DownloadOutcome.FAILED, errorKey, reasonCode);
    }

    private List<Entry> mergeLocalPaths(List<Entry> entries, List<ImageDownloadStatus> statuses) {
        Map<String, String> paths = new HashMap<>();
        for (ImageDownloadStatus status : statuses) {
            if (status.isSatisfied()) {
                paths.put(status.entryId() + "#" + status.sequence(), status.localPath());
            }
        }
        List<Entry> updated = new ArrayList<>();
        for (Entry entry : entries) {
            List<ImageReference> images = new ArrayList<>();
            for (ImageReference image : entry.imageCandidates()) {
                String path = paths.get(entry.id() + "#" + image.sequence());
                images.add(path == null ? image : image.withLocalPath(path));
            }
            updated.add(entry.withImageCandidates(images));
        }
        return updated;
    }
}
