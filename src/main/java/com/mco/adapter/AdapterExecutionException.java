package com.mco.adapter;

/**
 * Thrown by an {@link ExecutorAdapter} when the backend fails outright. The orchestration's
 * state is left untouched so the same directive can be executed again.
 */
public class AdapterExecutionException extends RuntimeException {

    private final String adapterName;

    public AdapterExecutionException(String adapterName, String message) {
        super(message);
        this.adapterName = adapterName;
    }

    public AdapterExecutionException(String adapterName, String message, Throwable cause) {
        super(message, cause);
        this.adapterName = adapterName;
    }

    public String getAdapterName() {
        return adapterName;
    }
}
