package com.schedsim.scheduling;

import com.schedsim.process.ProcessRuntime;
import java.util.List;

/**
 * PriorityScheduling
 *
 * Selecciona el proceso con la prioridad más alta (valor numérico menor =
 * mayor prioridad). En caso de empate gana quien entró antes en READY y
 * después el id menor. En modo con desalojo, un proceso listo con prioridad
 * estrictamente menor desplaza al que está en ejecución en la siguiente
 * frontera de tick.
 */
public class PriorityScheduling implements SchedulingAlgorithm {
    private final boolean preemptive;

    /**
     * @param preemptive true para desalojar ante llegadas más urgentes
     */
    public PriorityScheduling(boolean preemptive) {
        this.preemptive = preemptive;
    }

    /**
     * Recorre la ready queue y devuelve el proceso con prioridad mínima.
     *
     * @param currentTick tick actual
     * @param readySet    lista de procesos READY
     * @param running     proceso en ejecución o null
     * @return decisión o IDLE si no hay procesos
     */
    @Override
    public SchedulingDecision selectNext(int currentTick, List<ProcessRuntime> readySet, ProcessRuntime running) {
        ProcessRuntime highest = ReadyOrder.first(readySet, ReadyOrder.BY_PRIORITY);
        if (running != null
                && (!preemptive || highest == null || highest.getPriority() >= running.getPriority())) {
            return SchedulingDecision.run(running.getId(), running.getRemainingTime());
        }
        if (highest == null) {
            return SchedulingDecision.idle();
        }
        return SchedulingDecision.run(highest.getId(), highest.getRemainingTime());
    }

    @Override
    public boolean isPreemptive() {
        return preemptive;
    }

    /**
     * Nombre legible del algoritmo.
     *
     * @return nombre del algoritmo
     */
    @Override
    public String getName() {
        return preemptive ? "Priority Scheduling (preemptive)" : "Priority Scheduling (non-preemptive)";
    }
}
