package com.schedsim.simulator;

import java.util.Objects;

/**
 * ProcessMetrics
 *
 * Métricas derivadas de un proceso terminado.
 */
public final class ProcessMetrics {
    private final int processId;
    private final int arrivalTime;
    private final int burstTime;
    private final int priority;
    private final int firstRunTime;
    private final int completionTime;
    private final int waitingTime;
    private final int turnaroundTime;
    private final int responseTime;

    public ProcessMetrics(int processId, int arrivalTime, int burstTime, int priority,
            int firstRunTime, int completionTime) {
        this.processId = processId;
        this.arrivalTime = arrivalTime;
        this.burstTime = burstTime;
        this.priority = priority;
        this.firstRunTime = firstRunTime;
        this.completionTime = completionTime;
        this.turnaroundTime = completionTime - arrivalTime;
        this.waitingTime = turnaroundTime - burstTime;
        this.responseTime = firstRunTime - arrivalTime;
    }

    public int getProcessId() {
        return processId;
    }

    public int getArrivalTime() {
        return arrivalTime;
    }

    public int getBurstTime() {
        return burstTime;
    }

    public int getPriority() {
        return priority;
    }

    public int getFirstRunTime() {
        return firstRunTime;
    }

    public int getCompletionTime() {
        return completionTime;
    }

    /**
     * Tiempo en READY sin ejecutarse: turnaround menos burst.
     */
    public int getWaitingTime() {
        return waitingTime;
    }

    /**
     * Tiempo desde la llegada hasta la finalización.
     */
    public int getTurnaroundTime() {
        return turnaroundTime;
    }

    /**
     * Tiempo desde la llegada hasta el primer despacho.
     */
    public int getResponseTime() {
        return responseTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProcessMetrics)) {
            return false;
        }
        ProcessMetrics other = (ProcessMetrics) o;
        return processId == other.processId
                && arrivalTime == other.arrivalTime
                && burstTime == other.burstTime
                && priority == other.priority
                && firstRunTime == other.firstRunTime
                && completionTime == other.completionTime;
    }

    @Override
    public int hashCode() {
        return Objects.hash(processId, arrivalTime, burstTime, priority, firstRunTime, completionTime);
    }

    @Override
    public String toString() {
        return "P" + processId + " (waiting=" + waitingTime + ", turnaround=" + turnaroundTime
                + ", response=" + responseTime + ")";
    }
}
