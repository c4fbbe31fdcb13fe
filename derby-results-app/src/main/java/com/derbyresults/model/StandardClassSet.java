package com.derbyresults.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ordered vocabulary of standard class names. The order is display order; one member is the finals class.
 */
public final class StandardClassSet {

    private final List<String> names;
    private final String finalsClass;

    public StandardClassSet(List<String> names, String finalsClass) {
        if (names == null || names.isEmpty()) {
            throw new IllegalStateException("At least one standard class is required");
        }
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Standard class names must not be blank");
            }
            if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                throw new IllegalStateException("Duplicate standard class: " + name);
            }
        }
        if (finalsClass == null || !names.contains(finalsClass)) {
            throw new IllegalStateException("Finals class '" + finalsClass + "' is not one of " + names);
        }
        this.names = List.copyOf(names);
        this.finalsClass = finalsClass;
    }

    public List<String> names() {
        return names;
    }

    public String finalsClass() {
        return finalsClass;
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public boolean isFinals(String name) {
        return finalsClass.equals(name);
    }

    /** Den classes in display order, i.e. everything except the finals class. */
    public List<String> denClasses() {
        List<String> dens = new ArrayList<>(names);
        dens.remove(finalsClass);
        return dens;
    }

    /** Position in display order; unknown names sort last. */
    public int indexOf(String name) {
        int idx = names.indexOf(name);
        return idx >= 0 ? idx : Integer.MAX_VALUE;
    }

    /** Display order, unknown names after known ones and alphabetical among themselves. */
    public Comparator<String> displayOrder() {
        return Comparator.comparingInt(this::indexOf).thenComparing(Comparator.naturalOrder());
    }
}
