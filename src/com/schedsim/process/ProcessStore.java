package com.schedsim.process;

import com.schedsim.exception.DuplicateProcessIdException;
import com.schedsim.exception.InvalidArrivalTimeException;
import com.schedsim.exception.InvalidBurstTimeException;
import com.schedsim.exception.TickOverflowException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ProcessStore
 *
 * Almacén de descriptores de una simulación. Tiene una fase de registro,
 * cerrada con {@link #close()}, tras la cual no admite cambios. El orden de
 * {@link #all()} (llegada, luego id) es el que hace reproducibles los
 * desempates.
 */
public class ProcessStore {
    public static final Comparator<ProcessDescriptor> ARRIVAL_ORDER = Comparator
            .comparingInt(ProcessDescriptor::getArrivalTime)
            .thenComparingInt(ProcessDescriptor::getId);

    private final Map<Integer, ProcessDescriptor> descriptors = new LinkedHashMap<>();
    private boolean closed = false;
    private long totalBurstTime = 0;
    private int maxArrivalTime = 0;

    /**
     * Crea un almacén vacío.
     */
    public ProcessStore() {
    }

    /**
     * Crea un almacén con los descriptores dados ya registrados (sin cerrar).
     *
     * @param initial descriptores a registrar
     */
    public ProcessStore(List<ProcessDescriptor> initial) {
        for (ProcessDescriptor d : initial) {
            register(d);
        }
    }

    /**
     * Registra un descriptor.
     *
     * @param descriptor descriptor a registrar
     * @throws DuplicateProcessIdException  si el id ya existe
     * @throws InvalidBurstTimeException    si burstTime es menor o igual a 0
     * @throws InvalidArrivalTimeException  si arrivalTime es negativo
     * @throws TickOverflowException        si la suma de ráfagas más la última
     *                                      llegada no cabe en un int
     * @throws IllegalStateException        si el registro ya fue cerrado
     */
    public void register(ProcessDescriptor descriptor) {
        if (closed) {
            throw new IllegalStateException("registration phase is closed");
        }
        if (descriptors.containsKey(descriptor.getId())) {
            throw new DuplicateProcessIdException(descriptor.getId());
        }
        if (descriptor.getBurstTime() <= 0) {
            throw new InvalidBurstTimeException(descriptor.getId(), descriptor.getBurstTime());
        }
        if (descriptor.getArrivalTime() < 0) {
            throw new InvalidArrivalTimeException(descriptor.getId(), descriptor.getArrivalTime());
        }
        long burst = totalBurstTime + descriptor.getBurstTime();
        int arrival = Math.max(maxArrivalTime, descriptor.getArrivalTime());
        if (burst + arrival > Integer.MAX_VALUE) {
            throw new TickOverflowException(descriptor.getId(), burst, arrival);
        }
        descriptors.put(descriptor.getId(), descriptor);
        totalBurstTime = burst;
        maxArrivalTime = arrival;
    }

    /**
     * Cierra la fase de registro.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return descriptors.size();
    }

    /**
     * Devuelve todos los descriptores ordenados por llegada y luego por id.
     *
     * @return lista inmutable
     */
    public List<ProcessDescriptor> all() {
        List<ProcessDescriptor> ordered = new ArrayList<>(descriptors.values());
        ordered.sort(ARRIVAL_ORDER);
        return Collections.unmodifiableList(ordered);
    }

    /**
     * Construye un estado de ejecución nuevo (NEW) por descriptor, en el orden
     * de {@link #all()}.
     *
     * @return lista de ProcessRuntime
     */
    public List<ProcessRuntime> createRuntimes() {
        List<ProcessRuntime> runtimes = new ArrayList<>();
        for (ProcessDescriptor d : all()) {
            runtimes.add(new ProcessRuntime(d));
        }
        return runtimes;
    }

    /**
     * Suma de ráfagas registradas. Junto con {@link #getMaxArrivalTime()}
     * acota la duración de cualquier simulación y nunca supera
     * Integer.MAX_VALUE entre las dos.
     */
    public long getTotalBurstTime() {
        return totalBurstTime;
    }

    public int getMaxArrivalTime() {
        return maxArrivalTime;
    }
}
