package com.schedsim.simulator;

import com.schedsim.exception.InvalidCpuCountException;
import com.schedsim.exception.InvalidQuantumException;
import com.schedsim.scheduling.SchedulingAlgorithm;
import com.schedsim.scheduling.SchedulingPolicy;

/**
 * SimulationConfig
 *
 * Selección de política y sus parámetros. El quantum solo se valida cuando
 * la política es Round-Robin; el número de CPUs se valida siempre.
 */
public class SimulationConfig {
    public static final int DEFAULT_QUANTUM = 4;
    public static final int DEFAULT_CPU_COUNT = 1;

    private final SchedulingPolicy policy;
    private final int quantum;
    private final int cpuCount;
    private final boolean traceEvents;

    public SimulationConfig(SchedulingPolicy policy) {
        this(policy, DEFAULT_QUANTUM, DEFAULT_CPU_COUNT, false);
    }

    public SimulationConfig(SchedulingPolicy policy, int quantum) {
        this(policy, quantum, DEFAULT_CPU_COUNT, false);
    }

    /**
     * @param policy      política de planificación
     * @param quantum     quantum en ticks para Round-Robin
     * @param cpuCount    número de CPUs que comparten la cola de listos
     * @param traceEvents true para escribir cada evento del motor en el log
     * @throws InvalidCpuCountException si cpuCount es menor que 1
     */
    public SimulationConfig(SchedulingPolicy policy, int quantum, int cpuCount, boolean traceEvents) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        if (cpuCount < 1) {
            throw new InvalidCpuCountException(cpuCount);
        }
        this.policy = policy;
        this.quantum = quantum;
        this.cpuCount = cpuCount;
        this.traceEvents = traceEvents;
    }

    /**
     * Comprueba los parámetros y construye el algoritmo.
     *
     * @return algoritmo configurado
     * @throws InvalidQuantumException si Round-Robin recibe quantum menor o igual a 0
     */
    public SchedulingAlgorithm createAlgorithm() {
        return policy.create(quantum);
    }

    /**
     * Misma configuración con otra política.
     */
    public SimulationConfig withPolicy(SchedulingPolicy other) {
        return new SimulationConfig(other, quantum, cpuCount, traceEvents);
    }

    public int getCpuCount() {
        return cpuCount;
    }

    public boolean isTraceEvents() {
        return traceEvents;
    }

    @Override
    public String toString() {
        String name = policy.usesQuantum() ? policy.getDisplayName() + " (quantum=" + quantum + ")"
                : policy.getDisplayName();
        return cpuCount == 1 ? name : name + " on " + cpuCount + " CPUs";
    }
}
