package com.dokanclient.exception;

import com.dokanclient.model.enums.ErrorKind;

public class SerializationException extends DokanException {

    public SerializationException(String message) {
        super(ErrorKind.SERIALIZATION, 0, message);
    }

    public SerializationException(String message, Throwable cause) {
        super(ErrorKind.SERIALIZATION, 0, message, cause);
    }
}
