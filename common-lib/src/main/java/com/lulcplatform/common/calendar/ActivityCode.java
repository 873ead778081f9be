package com.lulcplatform.common.calendar;

import java.util.Locale;

/**
 * Decoded crop-calendar activity code.
 *
 * <p>A code containing {@code P} means planting; independently, a code containing
 * {@code H} means harvest. Combined codes ({@code "PH"}, {@code "P/H"}) therefore
 * set both flags. Empty and unknown codes set neither and are not errors.
 */
public record ActivityCode(boolean planting, boolean harvest) {

    private static final ActivityCode NONE = new ActivityCode(false, false);

    public static ActivityCode parse(String code) {
        if (code == null) return NONE;
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) return NONE;
        return new ActivityCode(normalized.indexOf('P') >= 0, normalized.indexOf('H') >= 0);
    }

    public boolean hasActivity() {
        return planting || harvest;
    }

    /** Contribution to the intensity tally: 2 for a combined code, 1 for a single one. */
    public int intensity() {
        return (planting ? 1 : 0) + (harvest ? 1 : 0);
    }

    public ActivityType type() {
        if (planting && harvest) return ActivityType.PLANTING_AND_HARVEST;
        if (planting) return ActivityType.PLANTING;
        if (harvest) return ActivityType.HARVEST;
        return ActivityType.NONE;
    }
}
