package com.schedsim.exception;

/**
 * InvalidArrivalTimeException
 *
 * Se lanza cuando un proceso declara un tiempo de llegada negativo.
 */
public class InvalidArrivalTimeException extends SimulationSetupException {
    private static final long serialVersionUID = 1L;

    public InvalidArrivalTimeException(int processId, int arrivalTime) {
        super("arrival time must be >= 0 (process " + processId + ", arrival " + arrivalTime + ")");
    }
}
