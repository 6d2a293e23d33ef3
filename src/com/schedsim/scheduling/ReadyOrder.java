package com.schedsim.scheduling;

import com.schedsim.process.ProcessRuntime;
import java.util.Comparator;
import java.util.List;

/**
 * Criterios de orden compartidos por las políticas.
 */
final class ReadyOrder {
    /** Llegada a READY y luego id. */
    static final Comparator<ProcessRuntime> BY_READY_SINCE = Comparator
            .comparingInt(ProcessRuntime::getReadySince)
            .thenComparingInt(ProcessRuntime::getId);

    /** Orden de rotación: llegada a READY y luego posición previa en la cola. */
    static final Comparator<ProcessRuntime> BY_ROTATION = Comparator
            .comparingInt(ProcessRuntime::getReadySince)
            .thenComparingLong(ProcessRuntime::getReadySequence);

    static final Comparator<ProcessRuntime> BY_REMAINING_TIME = Comparator
            .comparingInt(ProcessRuntime::getRemainingTime)
            .thenComparing(BY_READY_SINCE);

    static final Comparator<ProcessRuntime> BY_PRIORITY = Comparator
            .comparingInt(ProcessRuntime::getPriority)
            .thenComparing(BY_READY_SINCE);

    private ReadyOrder() {
    }

    /**
     * Devuelve el mínimo de la lista según el comparador o null si está vacía.
     */
    static ProcessRuntime first(List<ProcessRuntime> readySet, Comparator<ProcessRuntime> order) {
        if (readySet == null || readySet.isEmpty()) {
            return null;
        }
        ProcessRuntime best = readySet.get(0);
        for (ProcessRuntime p : readySet) {
            if (order.compare(p, best) < 0) {
                best = p;
            }
        }
        return best;
    }
}
