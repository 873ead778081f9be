package com.lulcplatform.analytics.loader;

/**
 * Where the three source files live. Values are Spring resource locations
 * ({@code classpath:data/x.jsonc}, {@code file:/srv/x.jsonc}); a location
 * without a prefix is read from the filesystem. A blank calendar location means
 * the deployment has no crop calendar.
 */
public record DataLocations(
    String initiatives,
    String metadata,
    String calendar
) {

    public boolean hasCalendar() {
        return calendar != null && !calendar.isBlank();
    }
}
