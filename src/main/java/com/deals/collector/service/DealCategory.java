package com.deals.collector.service;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Category slugs a deal can be listed under. Assigned once from the candidate source.
 */
public enum DealCategory {

    HOME("home", "Home"),
    KITCHEN("kitchen", "Home & Kitchen"),
    DIY("diy", "DIY & Tools"),
    ELECTRICAL("electrical", "Electronics"),
    TOYS("toys", "Toys & Games"),
    BEAUTY("beauty", "Beauty & Personal Care"),
    HEALTH("health", "Health & Household"),
    GROCERY("grocery", "Grocery & Gourmet"),
    PET("pet", "Pet Supplies"),
    SPORTS("sports", "Sports & Outdoors"),
    BABY("baby", "Baby Products"),
    AUTOMOTIVE("automotive", "Automotive"),
    GARDEN("garden", "Garden & Outdoors");

    private final String slug;
    private final String displayName;

    DealCategory(String slug, String displayName) {
        this.slug = slug;
        this.displayName = displayName;
    }

    public String getSlug() {
        return slug;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<DealCategory> fromSlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        String normalized = slug.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.slug.equals(normalized))
                .findFirst();
    }
}
