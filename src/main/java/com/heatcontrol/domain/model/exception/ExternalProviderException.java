package com.heatcontrol.domain.model.exception;

// Falla al consultar el proveedor de clima externo (red, timeout, respuesta mal formada)
public class ExternalProviderException extends HeatControlException {

    public ExternalProviderException(String message) {
        super(message);
    }

    public ExternalProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
