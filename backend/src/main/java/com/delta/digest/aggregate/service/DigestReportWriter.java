package com.delta.digest.aggregate.service;

import com.delta.digest.aggregate.model.DigestDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Component
public class DigestReportWriter {
    private static final Logger log = LoggerFactory.getLogger(DigestReportWriter.class);

    private final ObjectMapper objectMapper;

    public DigestReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path write(DigestDocument document, Path target) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] json = objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsBytes(document);
        Path temp = Files.createTempFile(parent, absolute.getFileName().toString() + ".", ".tmp");
        try {
            Files.write(temp, json);
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Wrote {} entries to {}", document.entries().size(), absolute);
        return absolute;
    }
}
