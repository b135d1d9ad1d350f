package com.digitalgroup.crm.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by every service. Callers branch on the kind,
 * never on the message text.
 */
@Getter
public enum ErrorKind {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    VALIDATION(HttpStatus.BAD_REQUEST),
    INVALID_STATE(HttpStatus.CONFLICT);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }
}
