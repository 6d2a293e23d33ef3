package com.schedsim.process;

import java.util.Objects;

/**
 * ProcessDescriptor
 *
 * Atributos de entrada de un proceso: identificador, tiempo de llegada,
 * ráfaga total de CPU y prioridad (menor = más urgente). Inmutable; la
 * validación de valores la realiza {@link ProcessStore} al registrarlo.
 */
public final class ProcessDescriptor {
    private final int id;
    private final int arrivalTime;
    private final int burstTime;
    private final int priority;

    /**
     * Construye un descriptor.
     *
     * @param id          identificador único
     * @param arrivalTime tick de llegada
     * @param burstTime   ticks de CPU requeridos
     * @param priority    prioridad (menor = más importante)
     */
    public ProcessDescriptor(int id, int arrivalTime, int burstTime, int priority) {
        this.id = id;
        this.arrivalTime = arrivalTime;
        this.burstTime = burstTime;
        this.priority = priority;
    }

    /**
     * Descriptor con prioridad 0, para políticas que la ignoran.
     */
    public static ProcessDescriptor of(int id, int arrivalTime, int burstTime) {
        return new ProcessDescriptor(id, arrivalTime, burstTime, 0);
    }

    public int getId() {
        return id;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProcessDescriptor)) {
            return false;
        }
        ProcessDescriptor other = (ProcessDescriptor) o;
        return id == other.id
                && arrivalTime == other.arrivalTime
                && burstTime == other.burstTime
                && priority == other.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, arrivalTime, burstTime, priority);
    }

    @Override
    public String toString() {
        return "P" + id + " (arrival=" + arrivalTime + ", burst=" + burstTime + ", priority=" + priority + ")";
    }
}
