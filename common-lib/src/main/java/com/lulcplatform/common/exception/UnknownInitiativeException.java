package com.lulcplatform.common.exception;

public class UnknownInitiativeException extends AnalyticsException {

    public UnknownInitiativeException(String initiativeName) {
        super(initiativeName, "initiative is not part of this analysis");
    }
}
