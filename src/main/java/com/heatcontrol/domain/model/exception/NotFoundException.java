package com.heatcontrol.domain.model.exception;

// La habitación o su horario no existen (o no pertenecen al dueño)
public class NotFoundException extends HeatControlException {

    public NotFoundException(String message) {
        super(message);
    }
}
