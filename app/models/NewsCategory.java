package models;

import java.util.Locale;

/**
 * Categories offered by the headline feed, in the order the reader lists them.
 */
public enum NewsCategory {
    BUSINESS,
    ENTERTAINMENT,
    HEALTH,
    SCIENCE,
    SPORTS,
    TECHNOLOGY;

    /** Category selected when the reader starts. */
    public static final NewsCategory DEFAULT = BUSINESS;

    /**
     * @return the value the News API expects for the {@code category} parameter
     */
    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup.
     *
     * @param value category name such as {@code "sports"}
     * @return the matching category
     * @throws IllegalArgumentException if {@code value} is blank or unknown
     */
    public static NewsCategory fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Category must not be blank");
        }
        for (NewsCategory c : values()) {
            if (c.apiValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + value);
    }
}
