package com.schedsim.process;

import com.schedsim.exception.SchedulerInvariantException;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * ProcessRuntime
 *
 * Estado de ejecución de un proceso durante una simulación. Mantiene:
 * - El descriptor inmutable del que proviene.
 * - Tiempo restante, estado y marcas de tiempo (primer despacho, fin,
 *   última entrada en READY).
 * - Registros de intervalos de CPU para el diagrama de Gantt.
 *
 * Solo el motor de planificación modifica estos objetos; las políticas se
 * limitan a leerlos. Un mismo objeto no se comparte entre simulaciones.
 */
public class ProcessRuntime {
    public static final int UNSET = -1;

    private final ProcessDescriptor descriptor;
    private ProcessState state;
    private int remainingTime;
    private int firstRunTime = UNSET;
    private int completionTime = UNSET;
    private int readySince = UNSET;
    private long readySequence = UNSET;
    private int dispatchCount = 0;

    /**
     * Interval
     *
     * Representa un intervalo [start, end) en ticks para Gantt.
     */
    public static class Interval {
        public final int start;
        public final int end;

        /**
         * Construye un intervalo inmutable.
         *
         * @param s inicio (inclusive)
         * @param e fin (exclusive)
         */
        public Interval(int s, int e) {
            this.start = s;
            this.end = e;
        }

        @Override
        public String toString() {
            return "[" + start + "," + end + ")";
        }
    }

    private final List<Interval> cpuIntervals = new LinkedList<>();
    private int cpuIntervalStart = UNSET;

    /**
     * Construye el estado inicial (NEW) de un proceso.
     *
     * @param descriptor descriptor ya validado
     */
    public ProcessRuntime(ProcessDescriptor descriptor) {
        this.descriptor = descriptor;
        this.state = ProcessState.NEW;
        this.remainingTime = descriptor.getBurstTime();
    }

    /**
     * Pasa el proceso a READY registrando el tick de entrada y su posición en
     * la rotación.
     *
     * @param tick     tick actual
     * @param sequence contador global de entradas en READY
     */
    public void markReady(int tick, long sequence) {
        this.state = ProcessState.READY;
        this.readySince = tick;
        this.readySequence = sequence;
    }

    /**
     * Pasa el proceso a RUNNING. La primera vez fija firstRunTime.
     *
     * @param tick tick del despacho
     */
    public void markRunning(int tick) {
        if (firstRunTime == UNSET) {
            firstRunTime = tick;
        }
        state = ProcessState.RUNNING;
        dispatchCount++;
    }

    /**
     * Consume un tick de CPU.
     *
     * @param tick tick que se está ejecutando
     */
    public void executeTick(int tick) {
        if (cpuIntervalStart == UNSET) {
            cpuIntervalStart = tick;
        }
        remainingTime--;
        if (remainingTime < 0) {
            throw new SchedulerInvariantException("negative remaining time for process " + getId());
        }
    }

    /**
     * Cierra el intervalo de CPU abierto (si existe) y lo registra.
     *
     * @param tick tick en el que el proceso deja la CPU
     */
    public void endCpuInterval(int tick) {
        if (cpuIntervalStart != UNSET) {
            cpuIntervals.add(new Interval(cpuIntervalStart, tick));
            cpuIntervalStart = UNSET;
        }
    }

    /**
     * Marca el proceso como terminado en el tick indicado.
     *
     * @param tick tick de finalización
     */
    public void markTerminated(int tick) {
        if (remainingTime != 0) {
            throw new SchedulerInvariantException("process " + getId() + " terminated with "
                    + remainingTime + " ticks left");
        }
        if (completionTime != UNSET) {
            throw new SchedulerInvariantException("process " + getId() + " terminated twice");
        }
        endCpuInterval(tick);
        completionTime = tick;
        state = ProcessState.TERMINATED;
    }

    public int getId() {
        return descriptor.getId();
    }

    public int getArrivalTime() {
        return descriptor.getArrivalTime();
    }

    public int getBurstTime() {
        return descriptor.getBurstTime();
    }

    public int getPriority() {
        return descriptor.getPriority();
    }

    public ProcessState getState() {
        return state;
    }

    public int getRemainingTime() {
        return remainingTime;
    }

    public int getFirstRunTime() {
        return firstRunTime;
    }

    public int getCompletionTime() {
        return completionTime;
    }

    public int getReadySince() {
        return readySince;
    }

    public long getReadySequence() {
        return readySequence;
    }

    public int getDispatchCount() {
        return dispatchCount;
    }

    /**
     * Devuelve una copia de los intervalos de CPU cerrados.
     *
     * @return lista de intervalos
     */
    public List<Interval> getCpuIntervals() {
        return new ArrayList<>(cpuIntervals);
    }

    /**
     * Indica si el proceso está en estado TERMINATED.
     *
     * @return true si terminado
     */
    public boolean isComplete() {
        return state == ProcessState.TERMINATED;
    }

    @Override
    public String toString() {
        return "P" + getId() + " [" + state.getDisplayName() + ", remaining=" + remainingTime + "]";
    }
}
