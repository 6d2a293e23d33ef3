package com.schedsim.scheduling;

import com.schedsim.process.ProcessRuntime;
import java.util.List;

/**
 * SJN (Shortest Job Next)
 *
 * Selecciona el proceso con menor tiempo restante. Empates por readySince y
 * luego por id. Sin desalojo; la variante con desalojo es {@link SRTF}.
 */
public class SJN implements SchedulingAlgorithm {

    /**
     * Recorre la ready queue y devuelve el proceso con menor tiempo restante.
     *
     * @param currentTick tick actual
     * @param readySet    lista de procesos READY
     * @param running     proceso en ejecución o null
     * @return decisión o IDLE si no hay procesos
     */
    @Override
    public SchedulingDecision selectNext(int currentTick, List<ProcessRuntime> readySet, ProcessRuntime running) {
        if (running != null) {
            return SchedulingDecision.run(running.getId(), running.getRemainingTime());
        }
        ProcessRuntime shortest = ReadyOrder.first(readySet, ReadyOrder.BY_REMAINING_TIME);
        if (shortest == null) {
            return SchedulingDecision.idle();
        }
        return SchedulingDecision.run(shortest.getId(), shortest.getRemainingTime());
    }

    @Override
    public boolean isPreemptive() {
        return false;
    }

    /**
     * Nombre legible del algoritmo.
     *
     * @return nombre descriptivo
     */
    @Override
    public String getName() {
        return "SJN (Shortest Job Next)";
    }
}
