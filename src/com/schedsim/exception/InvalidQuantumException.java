package com.schedsim.exception;

/**
 * InvalidQuantumException
 *
 * Se lanza cuando el quantum de Round-Robin no es positivo.
 */
public class InvalidQuantumException extends SimulationSetupException {
    private static final long serialVersionUID = 1L;

    public InvalidQuantumException(int quantum) {
        super("quantum must be > 0 (got " + quantum + ")");
    }
}
