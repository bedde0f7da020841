package com.eventvault.sync;

/**
 * The remote mirror cannot be reached. Does not consume retries; the worker
 * waits for connectivity instead.
 */
public class RemoteUnavailableException extends RemoteException {

    public RemoteUnavailableException(String message) {
        super(message);
    }

    public RemoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
