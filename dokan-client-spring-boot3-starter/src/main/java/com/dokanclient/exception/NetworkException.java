package com.dokanclient.exception;

import com.dokanclient.model.enums.ErrorKind;

import java.util.Objects;

public class NetworkException extends DokanException {

    public NetworkException(Throwable cause) {
        super(ErrorKind.NETWORK_FAILURE, 0,
                "network error: " + Objects.requireNonNull(cause, "cause"), cause);
    }
}
