package com.derbyresults.service;

import java.util.Map;

/**
 * A mapping entry points at a name that is neither a standard class nor SKIP.
 */
public class UnknownStandardClassException extends IllegalArgumentException {

    private final Map<String, String> invalidEntries;

    public UnknownStandardClassException(Map<String, String> invalidEntries) {
        super("Mapping targets are not standard classes: " + invalidEntries);
        this.invalidEntries = Map.copyOf(invalidEntries);
    }

    public Map<String, String> getInvalidEntries() {
        return invalidEntries;
    }
}
