package org.mediascan.exception;

import lombok.Getter;

@Getter
public enum ApiError {
    GENERIC_BAD_REQUEST("Bad request: %s"),
    INVALID_COLLECTION_TYPE("Unknown collection type: %s"),
    UNSUPPORTED_COLLECTION_TYPE("Collection type %s does not hold video and cannot be grouped by version"),
    INVALID_NAMING_OPTION("Invalid naming option '%s': %s");

    private final String message;

    ApiError(String message) {
        this.message = message;
    }

    public APIException createException(Object... details) {
        String formattedMessage = (details.length > 0) ? String.format(message, details) : message;
        return new APIException(this, formattedMessage);
    }
}
