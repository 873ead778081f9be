package com.lulcplatform.analytics.loader;

import com.lulcplatform.common.exception.AnalyticsException;

/**
 * A source file is missing, unreadable or not valid JSON. The subject is the
 * resource location.
 */
public class DataLoadException extends AnalyticsException {

    public DataLoadException(String location, String message) {
        super(location, message);
    }

    public DataLoadException(String location, String message, Throwable cause) {
        super(location, message, cause);
    }
}
