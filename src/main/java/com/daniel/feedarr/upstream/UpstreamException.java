package com.daniel.feedarr.upstream;

import java.util.OptionalInt;

// Transport failure, timeout or non-2xx answer from the media server.
public class UpstreamException extends RuntimeException {

    private final Integer statusCode;

    public UpstreamException(Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
