package com.deals.collector.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps marketplace root category names onto deal categories.
 */
public final class CategoryResolver {

    /**
     * Curated root categories browsed for deals, matched when the normalized root name contains
     * every keyword.
     */
    static final Map<String, List<String>> CURATED_ROOTS = curatedRoots();

    private CategoryResolver() {
    }

    private static Map<String, List<String>> curatedRoots() {
        Map<String, List<String>> roots = new LinkedHashMap<>();
        roots.put("home_kitchen", List.of("home", "kitchen"));
        roots.put("diy_tools", List.of("diy", "tools"));
        roots.put("toys_games", List.of("toys"));
        roots.put("electronics", List.of("electronics"));
        roots.put("beauty", List.of("beauty"));
        roots.put("health", List.of("health"));
        roots.put("grocery", List.of("grocery"));
        roots.put("pet", List.of("pet"));
        roots.put("sports", List.of("sports"));
        roots.put("baby", List.of("baby"));
        roots.put("automotive", List.of("automotive"));
        roots.put("garden", List.of("garden", "outdoor"));
        return roots;
    }

    /**
     * Category of a root name. The more specific buckets are checked first; anything
     * unrecognized falls back to HOME.
     */
    public static DealCategory resolve(String rootName) {
        String root = normalize(rootName);

        if (root.contains("beauty")) return DealCategory.BEAUTY;
        if (root.contains("health")) return DealCategory.HEALTH;
        if (root.contains("grocery") || root.contains("food")) return DealCategory.GROCERY;
        if (root.contains("pet")) return DealCategory.PET;
        if (root.contains("garden") || root.contains("lawn")
                || (root.contains("outdoor") && !root.contains("sports"))) return DealCategory.GARDEN;
        if (root.contains("sports") || root.contains("outdoors")) return DealCategory.SPORTS;
        if (root.contains("baby")) return DealCategory.BABY;
        if (root.contains("automotive")) return DealCategory.AUTOMOTIVE;
        if (root.contains("home") && root.contains("kitchen")) return DealCategory.HOME;
        if (root.contains("diy") || root.contains("tools")) return DealCategory.DIY;
        if (root.contains("toys") || root.contains("games")) return DealCategory.TOYS;
        if (root.contains("electronics")) return DealCategory.ELECTRICAL;
        return DealCategory.HOME;
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (Character.isLetterOrDigit(c) || Character.isWhitespace(c)) {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString().trim();
    }

    /**
     * Key of the curated root the name belongs to, if any.
     */
    public static Optional<String> curatedKey(String rootName) {
        String name = normalize(rootName);
        return CURATED_ROOTS.entrySet().stream()
                .filter(e -> e.getValue().stream().allMatch(name::contains))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
