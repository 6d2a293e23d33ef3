package com.schedsim.exception;

/**
 * InvalidBurstTimeException
 *
 * Se lanza cuando un proceso declara un burst time menor o igual a cero.
 */
public class InvalidBurstTimeException extends SimulationSetupException {
    private static final long serialVersionUID = 1L;

    public InvalidBurstTimeException(int processId, int burstTime) {
        super("burst time must be > 0 (process " + processId + ", burst " + burstTime + ")");
    }
}
