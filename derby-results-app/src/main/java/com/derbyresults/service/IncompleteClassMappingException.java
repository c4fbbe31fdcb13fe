package com.derbyresults.service;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Raised before merging when observed class labels have no mapping entry.
 */
public class IncompleteClassMappingException extends IllegalArgumentException {

    private final List<String> unmappedLabels;

    public IncompleteClassMappingException(Set<String> unmappedLabels) {
        super("No class mapping for: " + new TreeSet<>(unmappedLabels));
        this.unmappedLabels = List.copyOf(new TreeSet<>(unmappedLabels));
    }

    public List<String> getUnmappedLabels() {
        return unmappedLabels;
    }
}
