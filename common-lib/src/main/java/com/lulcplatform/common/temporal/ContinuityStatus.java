package com.lulcplatform.common.temporal;

/**
 * Continuity label shown next to each initiative in the temporal summary.
 */
public enum ContinuityStatus {

    /** At least one year and no gap between the first and last year. */
    CONTINUOUS,

    /** At least one gap inside the active period. */
    WITH_GAPS,

    /** No decodable year; reported separately rather than dropped. */
    NO_DATA
}
