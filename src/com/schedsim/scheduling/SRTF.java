package com.schedsim.scheduling;

import com.schedsim.process.ProcessRuntime;
import java.util.List;

/**
 * SRTF (Shortest Remaining Time First)
 *
 * Variante con desalojo de SJN. El proceso en ejecución solo cede la CPU si
 * aparece en READY otro con tiempo restante estrictamente menor.
 */
public class SRTF implements SchedulingAlgorithm {

    @Override
    public SchedulingDecision selectNext(int currentTick, List<ProcessRuntime> readySet, ProcessRuntime running) {
        ProcessRuntime shortest = ReadyOrder.first(readySet, ReadyOrder.BY_REMAINING_TIME);
        if (running != null
                && (shortest == null || shortest.getRemainingTime() >= running.getRemainingTime())) {
            return SchedulingDecision.run(running.getId(), running.getRemainingTime());
        }
        if (shortest == null) {
            return SchedulingDecision.idle();
        }
        return SchedulingDecision.run(shortest.getId(), shortest.getRemainingTime());
    }

    @Override
    public boolean isPreemptive() {
        return true;
    }

    @Override
    public String getName() {
        return "SRTF (Shortest Remaining Time First)";
    }
}
