package com.digitalgroup.crm.exception;

/**
 * Request is well-formed but violates a business rule (missing template,
 * empty audience, record from another campaign, ...).
 */
public class BusinessException extends ApplicationException {

    public BusinessException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
