package com.schedsim.exception;

/**
 * DuplicateProcessIdException
 *
 * Se lanza al registrar un proceso cuyo id ya existe en el almacén.
 */
public class DuplicateProcessIdException extends SimulationSetupException {
    private static final long serialVersionUID = 1L;

    private final int processId;

    public DuplicateProcessIdException(int processId) {
        super("duplicate process id: " + processId);
        this.processId = processId;
    }

    public int getProcessId() {
        return processId;
    }
}
