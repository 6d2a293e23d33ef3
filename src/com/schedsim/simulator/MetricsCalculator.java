package com.schedsim.simulator;

import com.schedsim.exception.IncompleteSimulationException;
import com.schedsim.process.ProcessRuntime;
import java.util.ArrayList;
import java.util.List;

/**
 * MetricsCalculator
 *
 * Deriva las métricas de una simulación terminada a partir de las marcas de
 * tiempo registradas por el motor. No tiene estado: la misma entrada produce
 * siempre un informe igual.
 */
public final class MetricsCalculator {

    private MetricsCalculator() {
    }

    /**
     * Calcula el informe de una simulación.
     *
     * @param policyName      nombre de la política usada
     * @param processes       procesos de la simulación, todos TERMINATED
     * @param cpuCount        número de CPUs simuladas
     * @param totalTicks      ticks simulados
     * @param idleTicks       ticks-CPU ociosos, sumados sobre todas las CPUs
     * @param contextSwitches cambios de contexto contabilizados
     * @param timeline        tramos de CPU en orden cronológico
     * @return informe inmutable
     * @throws IncompleteSimulationException si algún proceso no ha terminado
     */
    public static SimulationReport calculate(String policyName, List<ProcessRuntime> processes,
            int cpuCount, int totalTicks, long idleTicks, int contextSwitches, List<ExecutionSlice> timeline) {
        List<ProcessMetrics> metrics = new ArrayList<>();
        for (ProcessRuntime p : processes) {
            if (!p.isComplete()) {
                throw new IncompleteSimulationException("process " + p.getId() + " is "
                        + p.getState().getDisplayName() + "; metrics are only defined after the run completes");
            }
            metrics.add(new ProcessMetrics(p.getId(), p.getArrivalTime(), p.getBurstTime(), p.getPriority(),
                    p.getFirstRunTime(), p.getCompletionTime()));
        }

        long capacity = (long) cpuCount * totalTicks;
        return new SimulationReport(policyName, metrics, timeline, cpuCount, totalTicks, idleTicks, contextSwitches,
                average(metrics, Metric.WAITING),
                average(metrics, Metric.TURNAROUND),
                average(metrics, Metric.RESPONSE),
                capacity == 0 ? 0 : (double) (capacity - idleTicks) / capacity,
                totalTicks == 0 ? 0 : (double) metrics.size() / totalTicks);
    }

    private enum Metric {
        WAITING, TURNAROUND, RESPONSE
    }

    /**
     * Media aritmética de una métrica o 0 si no hay procesos.
     */
    private static double average(List<ProcessMetrics> metrics, Metric metric) {
        if (metrics.isEmpty()) {
            return 0;
        }
        double total = 0;
        for (ProcessMetrics m : metrics) {
            total += switch (metric) {
                case WAITING -> m.getWaitingTime();
                case TURNAROUND -> m.getTurnaroundTime();
                case RESPONSE -> m.getResponseTime();
            };
        }
        return total / metrics.size();
    }
}
