package com.schedsim.scheduling;

import com.schedsim.process.ProcessRuntime;
import java.util.List;

/**
 * SchedulingAlgorithm
 *
 * Interfaz que deben implementar los algoritmos de planificación. Cada
 * implementación es una función de decisión pura: recibe el tick actual, los
 * procesos en READY y el proceso en ejecución, y devuelve qué ejecutar y
 * durante cuánto tiempo. Nunca modifica los procesos ni guarda estado entre
 * llamadas.
 */
public interface SchedulingAlgorithm {
    /**
     * Selecciona la siguiente unidad de trabajo.
     *
     * Si {@code running} no es null la política puede devolver su id para que
     * siga ejecutándose (conservando el resto de su asignación) o el id de un
     * proceso de {@code readySet} para desalojarlo.
     *
     * @param currentTick tick actual
     * @param readySet    procesos en estado READY (vista de solo lectura)
     * @param running     proceso en ejecución o {@code null}
     * @return decisión; IDLE solo si no hay proceso listo ni en ejecución
     */
    SchedulingDecision selectNext(int currentTick, List<ProcessRuntime> readySet, ProcessRuntime running);

    /**
     * Indica si el motor debe volver a consultar la política en cada frontera
     * de tick mientras hay un proceso en ejecución.
     *
     * @return true para políticas con desalojo
     */
    boolean isPreemptive();

    /**
     * Devuelve un nombre descriptivo del algoritmo (usado en informes).
     *
     * @return nombre del algoritmo
     */
    String getName();
}
