package com.eventvault.sync;

/**
 * Base type for failures reported by a {@link RemoteConnector}.
 */
public abstract class RemoteException extends Exception {

    protected RemoteException(String message) {
        super(message);
    }

    protected RemoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
