package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.DateKey;

/**
 * Object names are a pure function of identifier and day, so re-exporting a day overwrites the
 * earlier file instead of adding a second one.
 */
public final class BatchNamer {

    private BatchNamer() {
    }

    public static String name(String identifier, DateKey dateKey) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
        return identifier.trim() + "_" + dateKey;
    }

    public static String name(String identifier, String dateKey) {
        return name(identifier, DateKey.parse(dateKey));
    }
}
