package com.harvester.common.http;

import java.io.IOException;

/**
 * Network level failure: connect/read error, timeout or a non-success HTTP status.
 */
public class TransportException extends IOException {
    public static final int NO_STATUS = -1;

    private final String url;
    private final int status;

    public TransportException(String url, int status) {
        super("HTTP " + status + " for " + url);
        this.url = url;
        this.status = status;
    }

    public TransportException(String url, Throwable cause) {
        super(cause.getClass().getSimpleName() + ": " + cause.getMessage() + " for " + url, cause);
        this.url = url;
        this.status = NO_STATUS;
    }

    public String getUrl() {
        return url;
    }

    public int getStatus() {
        return status;
    }

    public boolean hasStatus() {
        return status != NO_STATUS;
    }
}
