package com.heatcontrol.domain.model.exception;

/**
 * Raíz de los errores del núcleo de control de calefacción.
 * Ninguno es fatal para el proceso: la capa REST los traduce a códigos HTTP
 * y el refresco de clima los registra y sigue con la siguiente ubicación.
 */
public abstract class HeatControlException extends RuntimeException {

    protected HeatControlException(String message) {
        super(message);
    }

    protected HeatControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
