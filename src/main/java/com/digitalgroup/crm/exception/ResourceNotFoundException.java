package com.digitalgroup.crm.exception;

import lombok.Getter;

@Getter
public class ResourceNotFoundException extends ApplicationException {

    private final String resource;
    private final Object identifier;

    public ResourceNotFoundException(String resource, Object identifier) {
        super(ErrorKind.NOT_FOUND, resource + " not found with id: " + identifier);
        this.resource = resource;
        this.identifier = identifier;
    }
}
