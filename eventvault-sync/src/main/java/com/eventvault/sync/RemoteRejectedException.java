package com.eventvault.sync;

/**
 * The remote side refused the request outright (bad request, auth). Retrying
 * the same payload will not help.
 */
public class RemoteRejectedException extends RemoteException {

    private final int status;

    public RemoteRejectedException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
