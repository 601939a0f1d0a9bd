package com.heatcontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Aplicación principal del sistema de control de calefacción.
 *
 * Guarda lecturas de temperatura por habitación y el clima exterior por dueño
 * en un almacén de series de tiempo, y decide si la calefacción de cada habitación
 * debe estar encendida según su horario día/noche.
 */
@SpringBootApplication
public class HeatControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeatControlApplication.class, args);
    }
}
