package com.delta.autoapply.run.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class RunUnavailableException extends RuntimeException {
    public RunUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
