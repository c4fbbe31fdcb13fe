package com.derbyresults.service;

import com.derbyresults.config.DerbyResultsConfig;
import com.derbyresults.model.ClassMapping;
import com.derbyresults.model.StandardClassSet;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Maps raw class labels onto the standard class vocabulary.
 * <p>
 * {@link #suggest(String)} is a keyword guess and only ever pre-fills a mapping.
 * {@link #requireComplete(Collection, ClassMapping)} is the gate the merge step relies on:
 * every observed label needs an explicit entry, there is no implicit default.
 */
@Service
public class ClassNameMapper {

    private final StandardClassSet classes;
    private final Map<String, List<String>> keywordFamilies;
    private final List<String> skipKeywords;

    @Autowired
    public ClassNameMapper(StandardClassSet classes, DerbyResultsConfig config) {
        this(classes, config.getKeywords(), config.getSkipKeywords());
    }

    public ClassNameMapper(StandardClassSet classes, Map<String, List<String>> keywords, List<String> skipKeywords) {
        this.classes = classes;
        this.keywordFamilies = buildFamilies(classes, keywords != null ? keywords : Map.of());
        this.skipKeywords = skipKeywords == null ? List.of() : skipKeywords.stream()
            .map(k -> k.toLowerCase(Locale.ROOT))
            .toList();
    }

    // ========== GUESSING ==========

    /**
     * Best-effort guess for one label: a standard class name, {@link ClassMapping#SKIP}, or empty.
     * The longest matching keyword wins; equal lengths go to the earlier standard class.
     */
    public Optional<String> suggest(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String lower = label.toLowerCase(Locale.ROOT);

        for (String skip : skipKeywords) {
            if (lower.contains(skip)) {
                return Optional.of(ClassMapping.SKIP);
            }
        }

        String best = null;
        int bestLength = 0;
        for (Map.Entry<String, List<String>> family : keywordFamilies.entrySet()) {
            for (String keyword : family.getValue()) {
                if (keyword.length() > bestLength && containsWord(lower, keyword)) {
                    best = family.getKey();
                    bestLength = keyword.length();
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /** Guesses for every label, in input order. Labels with no guess map to null. */
    public Map<String, String> suggestAll(Collection<String> labels) {
        Map<String, String> guesses = new LinkedHashMap<>();
        for (String label : labels) {
            guesses.put(label, suggest(label).orElse(null));
        }
        return guesses;
    }

    // ========== VALIDATION ==========

    /**
     * Fails unless every label has an entry and every entry targets a standard class or SKIP.
     *
     * @throws IncompleteClassMappingException if any label is missing from the mapping
     * @throws UnknownStandardClassException   if an entry targets an unknown class name
     */
    public void requireComplete(Collection<String> labels, ClassMapping mapping) {
        Set<String> missing = new LinkedHashSet<>();
        for (String label : labels) {
            if (!mapping.contains(label)) {
                missing.add(label);
            }
        }
        if (!missing.isEmpty()) {
            throw new IncompleteClassMappingException(missing);
        }

        Map<String, String> invalid = new LinkedHashMap<>();
        mapping.entries().forEach((label, target) -> {
            if (!ClassMapping.SKIP.equals(target) && !classes.contains(target)) {
                invalid.put(label, target);
            }
        });
        if (!invalid.isEmpty()) {
            throw new UnknownStandardClassException(invalid);
        }
    }

    /** Number of raw labels mapped to each standard class, in display order. */
    public Map<String, Integer> mappingCounts(ClassMapping mapping) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        classes.names().forEach(name -> counts.put(name, 0));
        mapping.entries().values().forEach(target -> counts.computeIfPresent(target, (k, v) -> v + 1));
        return counts;
    }

    /** Standard classes that more than one raw label maps to, with those labels. */
    public Map<String, List<String>> sharedTargets(ClassMapping mapping) {
        Map<String, List<String>> byTarget = new LinkedHashMap<>();
        classes.names().forEach(name -> byTarget.put(name, new ArrayList<>()));
        mapping.entries().forEach((label, target) -> {
            List<String> labels = byTarget.get(target);
            if (labels != null) labels.add(label);
        });
        byTarget.values().removeIf(labels -> labels.size() < 2);
        return byTarget;
    }

    // ========== HELPERS ==========

    private static Map<String, List<String>> buildFamilies(StandardClassSet classes, Map<String, List<String>> keywords) {
        Map<String, List<String>> families = new LinkedHashMap<>();
        for (String name : classes.names()) {
            Set<String> family = new LinkedHashSet<>();
            family.add(name.toLowerCase(Locale.ROOT));
            List<String> configured = keywords.get(name);
            if (configured != null) {
                configured.forEach(k -> family.add(k.toLowerCase(Locale.ROOT)));
            }
            families.put(name, List.copyOf(family));
        }
        return families;
    }

    // "aol" must not match inside "gaolers", but "wolves" may match "wolves den"
    private static boolean containsWord(String text, String keyword) {
        int from = 0;
        while (true) {
            int idx = text.indexOf(keyword, from);
            if (idx < 0) return false;
            boolean startOk = idx == 0 || !Character.isLetterOrDigit(text.charAt(idx - 1));
            if (startOk) return true;
            from = idx + 1;
        }
    }
}
