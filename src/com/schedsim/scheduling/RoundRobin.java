package com.schedsim.scheduling;

import com.schedsim.exception.InvalidQuantumException;
import com.schedsim.process.ProcessRuntime;
import java.util.List;

/**
 * RoundRobin
 *
 * Selecciona la cabeza de la rotación y le concede como máximo un quantum.
 * La rotación se deduce del propio estado de los procesos: primero quien
 * entró antes en READY y, a igual tick, quien ocupaba antes la cola. El
 * motor devuelve a READY al proceso que agota su quantum después de admitir
 * las llegadas de ese mismo tick, por lo que éstas quedan por delante.
 */
public class RoundRobin implements SchedulingAlgorithm {
    private final int quantum;

    /**
     * Construye un RoundRobin con el quantum especificado.
     *
     * @param quantum tamaño del quantum en ticks (debe ser >= 1)
     * @throws InvalidQuantumException si quantum es menor o igual a 0
     */
    public RoundRobin(int quantum) {
        if (quantum <= 0) {
            throw new InvalidQuantumException(quantum);
        }
        this.quantum = quantum;
    }

    /**
     * Devuelve el quantum configurado.
     *
     * @return quantum en ticks
     */
    public int getQuantum() {
        return quantum;
    }

    /**
     * Selecciona la cabeza de la rotación. Mientras el proceso en ejecución
     * conserve quantum, la decisión es que continúe.
     *
     * @param currentTick tick actual
     * @param readySet    lista de procesos READY
     * @param running     proceso en ejecución o null
     * @return decisión o IDLE si no hay procesos
     */
    @Override
    public SchedulingDecision selectNext(int currentTick, List<ProcessRuntime> readySet, ProcessRuntime running) {
        if (running != null) {
            return SchedulingDecision.run(running.getId(), Math.min(running.getRemainingTime(), quantum));
        }
        ProcessRuntime head = ReadyOrder.first(readySet, ReadyOrder.BY_ROTATION);
        if (head == null) {
            return SchedulingDecision.idle();
        }
        return SchedulingDecision.run(head.getId(), Math.min(head.getRemainingTime(), quantum));
    }

    /**
     * El desalojo por fin de quantum lo aplica el motor al agotarse la
     * asignación, sin reconsultar la política en cada tick.
     */
    @Override
    public boolean isPreemptive() {
        return false;
    }

    /**
     * Nombre legible del algoritmo, incluyendo el valor de quantum.
     *
     * @return nombre descriptivo
     */
    @Override
    public String getName() {
        return "Round Robin (Quantum: " + quantum + ")";
    }
}
