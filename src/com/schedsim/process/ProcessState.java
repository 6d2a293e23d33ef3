package com.schedsim.process;

/**
 * ProcessState
 *
 * Estados posibles de un proceso en el simulador. No se modela E/S, por lo
 * que no existe estado bloqueado.
 */
public enum ProcessState {
    NEW("New"),
    READY("Ready"),
    RUNNING("Running"),
    TERMINATED("Terminated");

    private final String displayName;

    ProcessState(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Devuelve el nombre legible del estado.
     *
     * @return nombre para mostrar
     */
    public String getDisplayName() {
        return displayName;
    }
}
