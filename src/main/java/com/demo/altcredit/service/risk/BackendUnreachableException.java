package com.demo.altcredit.service.risk;

import com.demo.altcredit.service.collect.ErrorKind;

public class BackendUnreachableException extends RuntimeException {

    public BackendUnreachableException(String message) {
        super(message);
    }

    public BackendUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorKind getKind() {
        return ErrorKind.BACKEND_UNREACHABLE;
    }
}
