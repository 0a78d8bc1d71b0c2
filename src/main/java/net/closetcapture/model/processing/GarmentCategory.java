package net.closetcapture.model.processing;

import jakarta.annotation.Nullable;
import java.util.Locale;

/** Garment categories the processing service may suggest. */
public enum GarmentCategory {
    TOP,
    BOTTOM,
    DRESS,
    OUTERWEAR,
    SHOES,
    ACCESSORY;

    /**
     * Parses a category label case-insensitively.
     *
     * @return the category, or null for blank or unknown labels
     */
    @Nullable
    public static GarmentCategory fromLabel(@Nullable String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (GarmentCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        return null;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
