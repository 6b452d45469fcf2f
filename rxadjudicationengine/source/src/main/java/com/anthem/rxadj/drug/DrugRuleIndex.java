package com.anthem.rxadj.drug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Immutable lookup of configured rules keyed by drug identifier.
 *
 * <p>A rule applies to a drug when its identifier equals the drug's NDC or is a prefix of
 * the drug's GPI. Every applicable rule is returned, not only the longest prefix, because
 * rules at different class granularities apply independently. Results keep the order in
 * which rules were configured so callers that depend on ordering stay deterministic.
 *
 * <p>The index looks up each prefix of the GPI against a hash map, so lookups cost
 * O(GPI length) regardless of how many rules are configured.
 */
public final class DrugRuleIndex<T> {

    private final Map<String, List<Entry<T>>> byIdentifier;
    private final int size;

    private DrugRuleIndex(Map<String, List<Entry<T>>> byIdentifier, int size) {
        this.byIdentifier = byIdentifier;
        this.size = size;
    }

    public static <T> DrugRuleIndex<T> of(List<T> rules, Function<T, String> identifierOf) {
        Map<String, List<Entry<T>>> map = new HashMap<>();
        int position = 0;
        for (T rule : rules) {
            String identifier = identifierOf.apply(rule);
            if (identifier != null && !identifier.isEmpty()) {
                map.computeIfAbsent(identifier, k -> new ArrayList<>()).add(new Entry<>(position, rule));
            }
            position++;
        }
        map.replaceAll((k, v) -> List.copyOf(v));
        return new DrugRuleIndex<>(Map.copyOf(map), position);
    }

    public static <T> DrugRuleIndex<T> empty() {
        return new DrugRuleIndex<>(Map.of(), 0);
    }

    /**
     * Rules matching the drug by exact NDC or by GPI prefix, in configuration order.
     */
    public List<T> match(DrugIdentifier drug) {
        if (drug == null) {
            return List.of();
        }
        TreeMap<Integer, T> matches = new TreeMap<>();
        if (drug.hasNdc()) {
            collect(drug.getNdc(), matches);
        }
        if (drug.hasGpi()) {
            collectPrefixes(drug.getGpi(), matches);
        }
        return toList(matches);
    }

    /**
     * Rules whose identifier is a prefix of the given class code, in configuration order.
     */
    public List<T> matchGpi(String gpi) {
        if (gpi == null || gpi.isEmpty()) {
            return List.of();
        }
        TreeMap<Integer, T> matches = new TreeMap<>();
        collectPrefixes(gpi, matches);
        return toList(matches);
    }

    public int size() {
        return size;
    }

    private void collectPrefixes(String gpi, TreeMap<Integer, T> matches) {
        for (int length = 1; length <= gpi.length(); length++) {
            collect(gpi.substring(0, length), matches);
        }
    }

    private void collect(String key, TreeMap<Integer, T> matches) {
        List<Entry<T>> entries = byIdentifier.get(key);
        if (entries != null) {
            for (Entry<T> entry : entries) {
                matches.putIfAbsent(entry.position, entry.rule);
            }
        }
    }

    private List<T> toList(TreeMap<Integer, T> matches) {
        if (matches.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(matches.values()));
    }

    private record Entry<T>(int position, T rule) {
    }
}
