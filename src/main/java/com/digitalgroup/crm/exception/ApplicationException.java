package com.digitalgroup.crm.exception;

import lombok.Getter;

@Getter
public abstract class ApplicationException extends RuntimeException {

    private final ErrorKind kind;

    protected ApplicationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
