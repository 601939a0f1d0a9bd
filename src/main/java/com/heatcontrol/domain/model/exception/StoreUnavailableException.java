package com.heatcontrol.domain.model.exception;

// El almacén de series de tiempo no respondió
public class StoreUnavailableException extends HeatControlException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
