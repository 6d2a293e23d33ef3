package com.schedsim.exception;

/**
 * TickOverflowException
 *
 * Se lanza cuando la carga registrada podría necesitar más ticks de los que
 * caben en el reloj (suma de ráfagas más la última llegada por encima de
 * Integer.MAX_VALUE).
 */
public class TickOverflowException extends SimulationSetupException {
    private static final long serialVersionUID = 1L;

    public TickOverflowException(int processId, long totalBurstTime, long maxArrivalTime) {
        super("process " + processId + " pushes the tick horizon past " + Integer.MAX_VALUE
                + " (total burst " + totalBurstTime + ", latest arrival " + maxArrivalTime + ")");
    }
}
