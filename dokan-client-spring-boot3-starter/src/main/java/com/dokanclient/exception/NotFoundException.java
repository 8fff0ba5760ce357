package com.dokanclient.exception;

import com.dokanclient.model.enums.ErrorKind;
import lombok.Getter;

@Getter
public class NotFoundException extends DokanException {

    private final String resource;

    private final Object id;

    public NotFoundException(String resource, Object id) {
        super(ErrorKind.NOT_FOUND, 404, "resource not found: " + resource + " with ID " + id);
        this.resource = resource;
        this.id = id;
    }
}
