package com.jfind.scan.util;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class ScanValidationException extends RuntimeException {
    public ScanValidationException(String message) {
        super(message);
    }

    public ScanValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
