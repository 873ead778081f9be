package com.lulcplatform.common.model;

/**
 * Column names of the flat initiative table handed over by the loader.
 */
public final class InitiativeColumns {

    public static final String NAME         = "name";
    public static final String ACRONYM      = "acronym";
    public static final String SCOPE        = "scope";
    public static final String RESOLUTION_M = "resolution_m";
    public static final String ACCURACY_PCT = "accuracy_pct";
    public static final String NUM_CLASSES  = "num_classes";
    public static final String METHODOLOGY  = "methodology";
    public static final String PROVIDER     = "provider";

    private InitiativeColumns() {}
}
