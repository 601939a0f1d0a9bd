package com.heatcontrol.domain.model.exception;

// Argumento inválido: lote demasiado grande, rango de tiempo mal formado, zona horaria desconocida...
public class InvalidArgumentException extends HeatControlException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
