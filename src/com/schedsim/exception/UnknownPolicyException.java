package com.schedsim.exception;

/**
 * UnknownPolicyException
 *
 * Se lanza cuando el nombre de política recibido no corresponde a ningún
 * algoritmo soportado.
 */
public class UnknownPolicyException extends SimulationSetupException {
    private static final long serialVersionUID = 1L;

    public UnknownPolicyException(String name) {
        super("not a valid scheduling policy: " + name);
    }
}
