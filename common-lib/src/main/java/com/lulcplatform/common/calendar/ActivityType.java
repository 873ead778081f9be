package com.lulcplatform.common.calendar;

/**
 * Classification of a calendar cell by the activities its code names.
 */
public enum ActivityType {
    PLANTING,
    HARVEST,
    PLANTING_AND_HARVEST,
    NONE
}
