package com.lulcplatform.common.exception;

public class InvalidYearWindowException extends AnalyticsException {
    private final int startYear;
    private final int endYear;

    public InvalidYearWindowException(int startYear, int endYear) {
        super("coverage", "start year " + startYear + " is after end year " + endYear);
        this.startYear = startYear;
        this.endYear = endYear;
    }

    public int getStartYear() {
        return startYear;
    }

    public int getEndYear() {
        return endYear;
    }
}
