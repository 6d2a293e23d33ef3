package com.schedsim.scheduling;

import com.schedsim.process.ProcessRuntime;
import java.util.List;

/**
 * FCFS (First Come, First Served)
 *
 * Selecciona el proceso que lleva más tiempo en la cola de listos; los
 * empates se resuelven por id ascendente. Sin desalojo: el proceso recibe
 * todo su tiempo restante.
 */
public class FCFS implements SchedulingAlgorithm {

    /**
     * Devuelve el proceso con menor readySince de la ready queue.
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
        ProcessRuntime first = ReadyOrder.first(readySet, ReadyOrder.BY_READY_SINCE);
        if (first == null) {
            return SchedulingDecision.idle();
        }
        return SchedulingDecision.run(first.getId(), first.getRemainingTime());
    }

    @Override
    public boolean isPreemptive() {
        return false;
    }

    /**
     * Nombre legible del algoritmo.
     *
     * @return nombre del algoritmo
     */
    @Override
    public String getName() {
        return "FCFS (First Come, First Served)";
    }
}
