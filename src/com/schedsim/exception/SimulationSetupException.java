package com.schedsim.exception;

/**
 * SimulationSetupException
 *
 * Error de configuración detectado antes de ejecutar el primer tick. El
 * llamador puede corregir la entrada y reintentar; nunca deja resultados
 * parciales.
 */
public class SimulationSetupException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public SimulationSetupException(String message) {
        super(message);
    }
}
