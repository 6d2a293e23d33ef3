package com.schedsim.exception;

/**
 * IncompleteSimulationException
 *
 * Se lanza al pedir métricas antes de que todos los procesos hayan terminado.
 */
public class IncompleteSimulationException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public IncompleteSimulationException(String message) {
        super(message);
    }
}
