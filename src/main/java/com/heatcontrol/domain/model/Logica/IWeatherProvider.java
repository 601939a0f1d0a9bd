package com.heatcontrol.domain.model.Logica;

import com.heatcontrol.domain.model.POJOS.WeatherObservation;
import com.heatcontrol.domain.model.exception.ExternalProviderException;

public interface IWeatherProvider {

    /**
     * Consulta el clima actual en unas coordenadas.
     * Cualquier falla (red, timeout, código no 2xx, campo faltante) se informa como ExternalProviderException.
     */
    WeatherObservation fetchCurrent(double latitude, double longitude) throws ExternalProviderException;
}
