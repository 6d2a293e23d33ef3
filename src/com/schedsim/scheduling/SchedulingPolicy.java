package com.schedsim.scheduling;

import com.schedsim.exception.UnknownPolicyException;
import java.util.List;
import java.util.Locale;

/**
 * SchedulingPolicy
 *
 * Conjunto cerrado de políticas soportadas. Cada constante sabe construir su
 * {@link SchedulingAlgorithm}; el quantum solo lo usa Round-Robin.
 */
public enum SchedulingPolicy {
    FCFS("FCFS", List.of("fcfs", "fifo")),
    SJN("SJN", List.of("sjn", "sjf")),
    SRTF("SRTF", List.of("srtf", "srt")),
    ROUND_ROBIN("Round Robin", List.of("rr", "round-robin", "roundrobin", "round_robin")),
    PRIORITY_PREEMPTIVE("Priority (preemptive)", List.of("priority", "priority-preemptive", "priority_preemptive")),
    PRIORITY_NON_PREEMPTIVE("Priority (non-preemptive)",
            List.of("priority-np", "priority-non-preemptive", "priority_non_preemptive"));

    private final String displayName;
    private final List<String> aliases;

    SchedulingPolicy(String displayName, List<String> aliases) {
        this.displayName = displayName;
        this.aliases = aliases;
    }

    /**
     * Devuelve el nombre para mostrar de la política.
     *
     * @return nombre legible
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Indica si la política usa el quantum de configuración.
     */
    public boolean usesQuantum() {
        return this == ROUND_ROBIN;
    }

    /**
     * Crea el algoritmo correspondiente.
     *
     * @param quantum quantum en ticks (solo para Round-Robin)
     * @return SchedulingAlgorithm instancia del algoritmo
     * @throws com.schedsim.exception.InvalidQuantumException si Round-Robin
     *                                                        recibe quantum menor o igual a 0
     */
    public SchedulingAlgorithm create(int quantum) {
        return switch (this) {
            case FCFS -> new com.schedsim.scheduling.FCFS();
            case SJN -> new com.schedsim.scheduling.SJN();
            case SRTF -> new com.schedsim.scheduling.SRTF();
            case ROUND_ROBIN -> new RoundRobin(quantum);
            case PRIORITY_PREEMPTIVE -> new PriorityScheduling(true);
            case PRIORITY_NON_PREEMPTIVE -> new PriorityScheduling(false);
        };
    }

    /**
     * Busca una política por nombre de constante o alias, sin distinguir
     * mayúsculas.
     *
     * @param name nombre recibido (p.ej. "rr", "FCFS", "priority-np")
     * @return política correspondiente
     * @throws UnknownPolicyException si el nombre no corresponde a ninguna
     */
    public static SchedulingPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownPolicyException(String.valueOf(name));
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (SchedulingPolicy policy : values()) {
            if (policy.name().toLowerCase(Locale.ROOT).equals(key) || policy.aliases.contains(key)) {
                return policy;
            }
        }
        throw new UnknownPolicyException(name);
    }
}
