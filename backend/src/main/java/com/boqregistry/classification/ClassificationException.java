package com.boqregistry.classification;

import lombok.Getter;

/**
 * Thrown when a classification request or configuration is invalid. API layer maps the error code to
 * 400/404/409 with ErrorBody.
 */
@Getter
public class ClassificationException extends RuntimeException {

    public static final String INVALID_RULES = "INVALID_RULES";
    public static final String DUPLICATE_ROW_POSITION = "DUPLICATE_ROW_POSITION";
    public static final String RECLASSIFY_NOT_CONFIRMED = "RECLASSIFY_NOT_CONFIRMED";
    public static final String CONSENT_REQUIRED = "CONSENT_REQUIRED";
    public static final String INVALID_OVERRIDE = "INVALID_OVERRIDE";
    public static final String ITEM_NOT_FOUND = "ITEM_NOT_FOUND";

    private final String errorCode;

    public ClassificationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
