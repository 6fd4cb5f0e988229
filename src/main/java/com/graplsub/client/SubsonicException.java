package com.graplsub.client;

/**
 * Base class for every error raised while talking to the Subsonic server. All of them are
 * fatal to the run.
 */
public abstract class SubsonicException extends Exception {

    protected SubsonicException(String message) {
        super(message);
    }

    protected SubsonicException(String message, Throwable cause) {
        super(message, cause);
    }
}
