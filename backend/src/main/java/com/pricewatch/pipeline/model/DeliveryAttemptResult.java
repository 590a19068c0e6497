package com.pricewatch.pipeline.model;

public record DeliveryAttemptResult(int statusCode, String errorCode, String errorMessage) {

    public boolean isSuccessful() {
        return errorCode == null && statusCode >= 200 && statusCode < 300;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorMessage == null ? errorCode : errorCode + ": " + errorMessage;
        }
        return "http_" + statusCode;
    }
}
