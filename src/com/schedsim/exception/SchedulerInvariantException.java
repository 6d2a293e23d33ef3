package com.schedsim.exception;

/**
 * SchedulerInvariantException
 *
 * Violación de un invariante del motor o de una política (bucle que no
 * termina, tiempo restante negativo, decisión sobre un proceso que no está
 * listo). Indica un defecto, no una entrada incorrecta, y no debe capturarse
 * dentro del simulador.
 */
public class SchedulerInvariantException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public SchedulerInvariantException(String message) {
        super(message);
    }
}
