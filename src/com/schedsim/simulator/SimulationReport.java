package com.schedsim.simulator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SimulationReport
 *
 * Resultado inmutable de una simulación: métricas por proceso, promedios,
 * utilización de CPU, throughput y la línea de tiempo de ejecución. Es el
 * único dato que se entrega a la capa de presentación.
 *
 * Los ticks ociosos y ocupados se cuentan por CPU: con dos CPUs, cada tick
 * del reloj aporta dos ticks-CPU.
 */
public final class SimulationReport {
    private final String policyName;
    private final List<ProcessMetrics> processes;
    private final List<ExecutionSlice> timeline;
    private final int cpuCount;
    private final int totalTicks;
    private final long idleTicks;
    private final int contextSwitches;
    private final double averageWaitingTime;
    private final double averageTurnaroundTime;
    private final double averageResponseTime;
    private final double cpuUtilization;
    private final double throughput;

    SimulationReport(String policyName, List<ProcessMetrics> processes, List<ExecutionSlice> timeline,
            int cpuCount, int totalTicks, long idleTicks, int contextSwitches,
            double averageWaitingTime, double averageTurnaroundTime, double averageResponseTime,
            double cpuUtilization, double throughput) {
        this.policyName = policyName;
        this.processes = Collections.unmodifiableList(new ArrayList<>(processes));
        this.timeline = Collections.unmodifiableList(new ArrayList<>(timeline));
        this.cpuCount = cpuCount;
        this.totalTicks = totalTicks;
        this.idleTicks = idleTicks;
        this.contextSwitches = contextSwitches;
        this.averageWaitingTime = averageWaitingTime;
        this.averageTurnaroundTime = averageTurnaroundTime;
        this.averageResponseTime = averageResponseTime;
        this.cpuUtilization = cpuUtilization;
        this.throughput = throughput;
    }

    public String getPolicyName() {
        return policyName;
    }

    /**
     * Métricas por proceso, en orden de llegada y luego id.
     *
     * @return lista inmutable
     */
    public List<ProcessMetrics> getProcesses() {
        return processes;
    }

    /**
     * Busca las métricas de un proceso.
     *
     * @param processId id del proceso
     * @return métricas del proceso
     * @throws IllegalArgumentException si el id no forma parte del informe
     */
    public ProcessMetrics getProcess(int processId) {
        for (ProcessMetrics m : processes) {
            if (m.getProcessId() == processId) {
                return m;
            }
        }
        throw new IllegalArgumentException("no process with id " + processId + " in report");
    }

    /**
     * Tramos de CPU en orden cronológico.
     *
     * @return lista inmutable
     */
    public List<ExecutionSlice> getTimeline() {
        return timeline;
    }

    public int getProcessCount() {
        return processes.size();
    }

    public int getCpuCount() {
        return cpuCount;
    }

    public int getTotalTicks() {
        return totalTicks;
    }

    /**
     * Ticks-CPU sin proceso asignado.
     */
    public long getIdleTicks() {
        return idleTicks;
    }

    /**
     * Ticks-CPU con un proceso en ejecución; igual a la suma de ráfagas.
     */
    public long getBusyTicks() {
        return (long) cpuCount * totalTicks - idleTicks;
    }

    public int getContextSwitches() {
        return contextSwitches;
    }

    public double getAverageWaitingTime() {
        return averageWaitingTime;
    }

    public double getAverageTurnaroundTime() {
        return averageTurnaroundTime;
    }

    public double getAverageResponseTime() {
        return averageResponseTime;
    }

    /**
     * Fracción de ticks-CPU ocupados, entre 0 y 1.
     */
    public double getCpuUtilization() {
        return cpuUtilization;
    }

    /**
     * Procesos completados por tick simulado.
     */
    public double getThroughput() {
        return throughput;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimulationReport)) {
            return false;
        }
        SimulationReport other = (SimulationReport) o;
        return cpuCount == other.cpuCount
                && totalTicks == other.totalTicks
                && idleTicks == other.idleTicks
                && contextSwitches == other.contextSwitches
                && Double.compare(averageWaitingTime, other.averageWaitingTime) == 0
                && Double.compare(averageTurnaroundTime, other.averageTurnaroundTime) == 0
                && Double.compare(averageResponseTime, other.averageResponseTime) == 0
                && Double.compare(cpuUtilization, other.cpuUtilization) == 0
                && Double.compare(throughput, other.throughput) == 0
                && policyName.equals(other.policyName)
                && processes.equals(other.processes)
                && timeline.equals(other.timeline);
    }

    @Override
    public int hashCode() {
        return Objects.hash(policyName, processes, timeline, cpuCount, totalTicks, idleTicks, contextSwitches,
                averageWaitingTime, averageTurnaroundTime, averageResponseTime, cpuUtilization, throughput);
    }

    @Override
    public String toString() {
        return String.format("%s: processes=%d cpus=%d ticks=%d avgWait=%.2f avgTurnaround=%.2f avgResponse=%.2f "
                + "cpu=%.2f%% throughput=%.4f", policyName, processes.size(), cpuCount, totalTicks,
                averageWaitingTime,
                averageTurnaroundTime, averageResponseTime, cpuUtilization * 100, throughput);
    }
}
