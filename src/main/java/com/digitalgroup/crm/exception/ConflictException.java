package com.digitalgroup.crm.exception;

public class ConflictException extends ApplicationException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
