package org.mediascan.exception;

import lombok.Getter;

@Getter
public class APIException extends RuntimeException {

    private final ApiError error;

    public APIException(ApiError error, String message) {
        super(message);
        this.error = error;
    }
}
