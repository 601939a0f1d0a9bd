package com.heatcontrol.domain.model.exception;

// No hay ninguna muestra dentro de la ventana de búsqueda
public class NoDataException extends HeatControlException {

    public NoDataException(String message) {
        super(message);
    }
}
