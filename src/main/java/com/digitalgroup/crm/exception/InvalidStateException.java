package com.digitalgroup.crm.exception;

import lombok.Getter;

@Getter
public class InvalidStateException extends ApplicationException {

    private final String currentState;

    public InvalidStateException(String message, String currentState) {
        super(ErrorKind.INVALID_STATE, message);
        this.currentState = currentState;
    }
}
