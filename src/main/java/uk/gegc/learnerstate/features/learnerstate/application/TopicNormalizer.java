package uk.gegc.learnerstate.features.learnerstate.application;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Maps free-form topic tags onto a fixed taxonomy so mastery keys stay consistent
 * no matter how the question source spells them ("Hash Map", "hashmap", "HASH_TABLE").
 */
@Component
public class TopicNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[_\\s]+");
    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9-]");
    private static final Pattern REPEATED_HYPHENS = Pattern.compile("-+");

    private static final Map<String, List<String>> TAXONOMY = taxonomy();

    /**
     * Normalizes a single tag. Unknown tags keep their cleaned-up form.
     *
     * @return the canonical topic, or {@code null} when nothing usable is left
     */
    public String normalize(String tag) {
        if (tag == null) {
            return null;
        }
        String cleaned = clean(tag);
        if (cleaned.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, List<String>> entry : TAXONOMY.entrySet()) {
            if (entry.getKey().equals(cleaned) || entry.getValue().contains(cleaned)) {
                return entry.getKey();
            }
        }
        return cleaned;
    }

    /**
     * @return the distinct canonical topics of {@code tags}, sorted; empty if none survive
     */
    public Set<String> normalize(Collection<String> tags) {
        Set<String> topics = new TreeSet<>();
        if (tags == null) {
            return topics;
        }
        for (String tag : tags) {
            String topic = normalize(tag);
            if (topic != null) {
                topics.add(topic);
            }
        }
        return topics;
    }

    public String displayName(String topic) {
        StringBuilder out = new StringBuilder();
        for (String word : topic.split("-")) {
            if (word.isEmpty()) continue;
            if (out.length() > 0) out.append(' ');
            out.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return out.toString();
    }

    private static String clean(String tag) {
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        normalized = SEPARATORS.matcher(normalized).replaceAll("-");
        normalized = DISALLOWED.matcher(normalized).replaceAll("");
        normalized = REPEATED_HYPHENS.matcher(normalized).replaceAll("-");
        int start = 0;
        int end = normalized.length();
        while (start < end && normalized.charAt(start) == '-') start++;
        while (end > start && normalized.charAt(end - 1) == '-') end--;
        return normalized.substring(start, end);
    }

    // Aliases are stored in cleaned form, so "hash map" is listed as "hash-map".
    private static Map<String, List<String>> taxonomy() {
        Map<String, List<String>> t = new LinkedHashMap<>();
        t.put("array", List.of("arrays"));
        t.put("string", List.of("strings", "string-matching"));
        t.put("linked-list", List.of("linkedlist"));
        t.put("stack", List.of("stacks"));
        t.put("queue", List.of("queues"));
        t.put("hash-table", List.of("hashtable", "hash-map", "hashmap", "dictionary"));
        t.put("tree", List.of("trees", "binary-tree"));
        t.put("graph", List.of("graphs"));
        t.put("heap", List.of("heaps", "priority-queue"));
        t.put("trie", List.of("tries", "prefix-tree"));
        t.put("sorting", List.of("sort", "merge-sort", "quick-sort", "heap-sort"));
        t.put("searching", List.of("search"));
        t.put("two-pointers", List.of("sliding-window"));
        t.put("dynamic-programming", List.of("dp"));
        t.put("greedy", List.of("greedy-algorithm"));
        t.put("divide-and-conquer", List.of());
        t.put("backtracking", List.of("backtrack"));
        t.put("recursion", List.of("recursive"));
        t.put("bit-manipulation", List.of("bitwise"));
        t.put("dfs", List.of("depth-first-search"));
        t.put("bfs", List.of("breadth-first-search"));
        t.put("union-find", List.of("disjoint-set"));
        t.put("topological-sort", List.of());
        t.put("math", List.of("mathematics", "mathematical"));
        t.put("geometry", List.of("geometric"));
        t.put("combinatorics", List.of("permutation", "combination"));
        t.put("number-theory", List.of());
        t.put("design", List.of("system-design", "oop"));
        t.put("simulation", List.of("simulator"));
        t.put("matrix", List.of("matrices", "2d-array"));
        t.put("prefix-sum", List.of());
        t.put("monotonic-stack", List.of());
        t.put("binary-search", List.of());
        return t;
    }
}
