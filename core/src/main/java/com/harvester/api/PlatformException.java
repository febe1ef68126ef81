package com.harvester.api;

import java.io.IOException;

/**
 * Raised by a {@link MessagingPlatform} when a channel or message is unknown,
 * inaccessible or malformed.
 */
public class PlatformException extends IOException {

    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
