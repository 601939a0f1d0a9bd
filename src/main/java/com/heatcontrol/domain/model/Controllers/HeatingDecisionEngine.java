package com.heatcontrol.domain.model.Controllers;

import com.heatcontrol.domain.model.POJOS.Decision;
import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.model.POJOS.Schedule;

import java.time.Instant;
import java.util.Objects;

/**
 * Lógica de decisión de calefacción.
 * Recibe el horario, la última lectura y el instante actual, y devuelve el veredicto.
 * La búsqueda del horario y de la lectura la hace el HeatControlService.
 *
 * No hay histéresis: con la lectura exactamente igual al objetivo la calefacción queda apagada.
 */
public class HeatingDecisionEngine {

    private final TargetResolver targetResolver;

    public HeatingDecisionEngine(TargetResolver targetResolver) {
        this.targetResolver = targetResolver;
    }

    public Decision evaluate(long roomId, Schedule schedule, Sample latestSample, Instant now) {
        Objects.requireNonNull(latestSample, "latestSample");
        double target = targetResolver.resolveTarget(schedule, now);
        boolean heatingOn = latestSample.getValue() < target;
        return new Decision(roomId, target, latestSample, heatingOn);
    }

    public TargetResolver getTargetResolver() {
        return targetResolver;
    }
}
