package com.derbyresults.service;

import com.derbyresults.model.SourceBundle;
import com.derbyresults.repository.SqliteSourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns uploaded race database files into source bundles. Each upload is copied to a temporary
 * file for the duration of the read and deleted afterwards.
 */
@Service
public class SourceImportService {

    private static final Logger log = LoggerFactory.getLogger(SourceImportService.class);

    private final SqliteSourceLoader loader;

    public SourceImportService(SqliteSourceLoader loader) {
        this.loader = loader;
    }

    public List<SourceBundle> importFiles(List<MultipartFile> files, Integer year) throws IOException {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("At least one race database file is required");
        }
        List<SourceBundle> bundles = new ArrayList<>();
        for (MultipartFile file : files) {
            String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
            try (InputStream in = file.getInputStream()) {
                bundles.add(importStream(in, name, year));
            }
        }
        return bundles;
    }

    public SourceBundle importStream(InputStream in, String sourceName, Integer year) throws IOException {
        Path temp = Files.createTempFile("race-db-", ".sqlite");
        try {
            Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            return loader.load(temp, year, sourceName);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.warn("Failed to delete temporary file {}", temp, e);
            }
        }
    }
}
