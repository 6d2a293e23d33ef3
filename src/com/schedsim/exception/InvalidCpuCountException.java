package com.schedsim.exception;

/**
 * InvalidCpuCountException
 *
 * Se lanza cuando el número de CPUs simuladas es menor que 1.
 */
public class InvalidCpuCountException extends SimulationSetupException {
    private static final long serialVersionUID = 1L;

    public InvalidCpuCountException(int cpuCount) {
        super("cpu count must be >= 1 (got " + cpuCount + ")");
    }
}
