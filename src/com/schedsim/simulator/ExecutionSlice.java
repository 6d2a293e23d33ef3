package com.schedsim.simulator;

import java.util.Comparator;
import java.util.Objects;

/**
 * ExecutionSlice
 *
 * Tramo [start, end) en el que un proceso ocupó una CPU sin interrupción.
 * La secuencia de tramos de una simulación forma su línea de tiempo.
 */
public final class ExecutionSlice {
    /** Orden cronológico; a igual inicio, por índice de CPU. */
    public static final Comparator<ExecutionSlice> CHRONOLOGICAL = Comparator
            .comparingInt(ExecutionSlice::getStart)
            .thenComparingInt(ExecutionSlice::getCpu);

    private final int processId;
    private final int start;
    private final int end;
    private final int cpu;

    public ExecutionSlice(int processId, int start, int end) {
        this(processId, start, end, 0);
    }

    /**
     * @param processId proceso que ocupó la CPU
     * @param start     primer tick del tramo
     * @param end       tick siguiente al último
     * @param cpu       índice de la CPU, desde 0
     */
    public ExecutionSlice(int processId, int start, int end, int cpu) {
        this.processId = processId;
        this.start = start;
        this.end = end;
        this.cpu = cpu;
    }

    public int getProcessId() {
        return processId;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getCpu() {
        return cpu;
    }

    public int length() {
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExecutionSlice)) {
            return false;
        }
        ExecutionSlice other = (ExecutionSlice) o;
        return processId == other.processId && start == other.start && end == other.end && cpu == other.cpu;
    }

    @Override
    public int hashCode() {
        return Objects.hash(processId, start, end, cpu);
    }

    @Override
    public String toString() {
        return (cpu == 0 ? "" : "CPU" + cpu + ":") + "P" + processId + "[" + start + "," + end + ")";
    }
}
