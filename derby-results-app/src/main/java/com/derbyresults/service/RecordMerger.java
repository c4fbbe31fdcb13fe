package com.derbyresults.service;

import com.derbyresults.model.CanonicalRecord;
import com.derbyresults.model.ClassMapping;
import com.derbyresults.model.RawRecord;
import com.derbyresults.model.SourceBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies a class mapping to every source and concatenates the survivors into one canonical table.
 * Every heat row is kept; rows are never deduplicated.
 */
@Service
public class RecordMerger {

    private static final Logger log = LoggerFactory.getLogger(RecordMerger.class);

    private final ClassNameMapper classNameMapper;

    public RecordMerger(ClassNameMapper classNameMapper) {
        this.classNameMapper = classNameMapper;
    }

    /**
     * Merge all bundles under one mapping, in bundle order.
     *
     * @throws IncompleteClassMappingException if any observed label is unmapped; nothing is merged
     */
    public List<CanonicalRecord> merge(List<SourceBundle> bundles, ClassMapping mapping) {
        classNameMapper.requireComplete(observedLabels(bundles), mapping);

        List<CanonicalRecord> merged = new ArrayList<>();
        for (SourceBundle bundle : bundles) {
            int skipped = 0;
            for (RawRecord raw : bundle.rawRecords()) {
                String label = raw.classLabelOrEmpty();
                if (mapping.isSkipped(label)) {
                    skipped++;
                    continue;
                }
                // requireComplete guarantees a target here
                String standardName = mapping.standardNameFor(label).orElseThrow();
                merged.add(CanonicalRecord.from(raw, standardName, bundle.year()));
            }
            log.debug("Source {}: {} rows kept, {} skipped",
                      bundle.sourceName(), bundle.rawRecords().size() - skipped, skipped);
        }

        log.info("Merged {} rows from {} source(s)", merged.size(), bundles.size());
        return merged;
    }

    /** Distinct labels across all bundles, first-seen order. */
    public static Set<String> observedLabels(List<SourceBundle> bundles) {
        Set<String> labels = new LinkedHashSet<>();
        bundles.forEach(b -> labels.addAll(b.classLabels()));
        return labels;
    }
}
