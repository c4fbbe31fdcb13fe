package com.derbyresults.controller;

import com.derbyresults.model.*;
import com.derbyresults.repository.RaceDatabaseException;
import com.derbyresults.service.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/results")
public class RaceResultsApiController {

    private static final Logger log = LoggerFactory.getLogger(RaceResultsApiController.class);

    private final StandardClassSet standardClasses;
    private final ClassNameMapper classNameMapper;
    private final RaceResultsService raceResultsService;
    private final CanonicalTableExporter exporter;
    private final SourceImportService sourceImportService;

    public RaceResultsApiController(StandardClassSet standardClasses,
                                    ClassNameMapper classNameMapper,
                                    RaceResultsService raceResultsService,
                                    CanonicalTableExporter exporter,
                                    SourceImportService sourceImportService) {
        this.standardClasses = standardClasses;
        this.classNameMapper = classNameMapper;
        this.raceResultsService = raceResultsService;
        this.exporter = exporter;
        this.sourceImportService = sourceImportService;
    }

    @GetMapping("/classes")
    public Map<String, Object> getClasses() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("standardClasses", standardClasses.names());
        response.put("finalsClass", standardClasses.finalsClass());
        response.put("skip", ClassMapping.SKIP);
        response.put("defaultPolicy", raceResultsService.getDefaultPolicy());
        return response;
    }

    @PostMapping("/mapping/suggest")
    public ResponseEntity<Map<String, String>> suggestMapping(@RequestBody List<String> labels) {
        if (labels == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(classNameMapper.suggestAll(labels));
    }

    @PostMapping(value = "/sources", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> importSources(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(value = "year", required = false) Integer year) {
        try {
            List<SourceBundle> sources = sourceImportService.importFiles(files, year);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("sources", sources);
            response.put("suggestedMapping", raceResultsService.suggestMapping(sources));
            return ResponseEntity.ok(response);
        } catch (RaceDatabaseException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IOException e) {
            log.error("Failed to read uploaded race database", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Failed to read uploaded file"));
        }
    }

    @PostMapping
    public ResponseEntity<?> process(@RequestBody RaceResultsRequest request) {
        if (request.sources() == null || request.sources().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No sources given"));
        }
        try {
            return ResponseEntity.ok(run(request));
        } catch (IncompleteClassMappingException e) {
            return ResponseEntity.unprocessableEntity()
                .body(Map.of("error", e.getMessage(), "unmappedLabels", e.getUnmappedLabels()));
        } catch (UnknownStandardClassException e) {
            return ResponseEntity.unprocessableEntity()
                .body(Map.of("error", e.getMessage(), "invalidEntries", e.getInvalidEntries()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping(value = "/export", produces = "text/csv")
    public ResponseEntity<String> export(@RequestBody RaceResultsRequest request) {
        if (request.sources() == null || request.sources().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            RaceReport report = run(request);
            return ResponseEntity.ok()
                .header("Content-Disposition", "attachment; filename=\"merged_race_data.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(exporter.toCsv(report.canonicalRecords()));
        } catch (IllegalArgumentException e) {
            // includes incomplete mappings; the CSV endpoint has no JSON error body
            return ResponseEntity.unprocessableEntity().build();
        }
    }

    private RaceReport run(RaceResultsRequest request) {
        RankingPolicy policy = request.policy() != null
            ? request.policy().applyTo(raceResultsService.getDefaultPolicy())
            : raceResultsService.getDefaultPolicy();
        return raceResultsService.process(request.sources(), ClassMapping.of(request.mapping()), policy);
    }
}
