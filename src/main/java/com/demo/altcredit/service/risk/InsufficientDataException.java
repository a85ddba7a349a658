package com.demo.altcredit.service.risk;

/** No source could be scored and no remote assessment was available. */
public class InsufficientDataException extends RuntimeException {
    public InsufficientDataException(String message) {
        super(message);
    }
}
