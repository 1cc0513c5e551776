package com.jfind.scan.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ScanNotFoundException extends RuntimeException {
    public ScanNotFoundException(long scanId) {
        super("Scan with ID " + scanId + " not found");
    }
}
