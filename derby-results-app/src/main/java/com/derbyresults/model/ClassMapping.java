package com.derbyresults.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit mapping from raw class labels (case-sensitive) to standard class names.
 * A label mapped to {@link #SKIP} is dropped from the merge entirely.
 */
public final class ClassMapping {

    public static final String SKIP = "SKIP";

    private final Map<String, String> entries;

    private ClassMapping(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Mapping from a label-to-target map as submitted by a client. A null or blank target means the
     * label has not been mapped yet and is left out, so the completeness check reports it.
     */
    public static ClassMapping of(Map<String, String> entries) {
        Builder builder = builder();
        if (entries != null) {
            entries.forEach((label, target) -> {
                if (target != null && !target.isBlank()) {
                    builder.map(label, target);
                }
            });
        }
        return builder.build();
    }

    public boolean contains(String label) {
        return entries.containsKey(label);
    }

    public boolean isSkipped(String label) {
        return SKIP.equals(entries.get(label));
    }

    /** Standard class for a label, empty when the label is unmapped or skipped. */
    public Optional<String> standardNameFor(String label) {
        String target = entries.get(label);
        if (target == null || SKIP.equals(target)) {
            return Optional.empty();
        }
        return Optional.of(target);
    }

    public Map<String, String> entries() {
        return entries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, String> entries = new LinkedHashMap<>();

        public Builder map(String label, String standardName) {
            if (label == null) throw new IllegalArgumentException("class label must not be null");
            if (standardName == null || standardName.isBlank()) {
                throw new IllegalArgumentException("mapping for '" + label + "' has no target");
            }
            entries.put(label, standardName);
            return this;
        }

        public Builder skip(String label) {
            return map(label, SKIP);
        }

        public ClassMapping build() {
            return new ClassMapping(entries);
        }
    }
}
