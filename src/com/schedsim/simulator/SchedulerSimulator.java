package com.schedsim.simulator;

import com.schedsim.process.ProcessDescriptor;
import com.schedsim.process.ProcessStore;
import com.schedsim.scheduling.SchedulingAlgorithm;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * SchedulerSimulator
 *
 * Punto de entrada de una simulación. El constructor valida toda la entrada
 * (ids duplicados, ráfagas no positivas, quantum o número de CPUs
 * inválidos) antes de que exista ningún tick; {@link #run()} crea un motor
 * nuevo en cada llamada, de modo que la misma entrada produce siempre el
 * mismo informe.
 */
public class SchedulerSimulator {
    private static final Logger logger = LogManager.getLogger(SchedulerSimulator.class);

    private final List<ProcessDescriptor> descriptors;
    private final SimulationConfig config;
    private final List<EventLogger.EventListener> listeners = new ArrayList<>();

    /**
     * @param descriptors procesos de la simulación
     * @param config      política y parámetros
     * @throws com.schedsim.exception.SimulationSetupException si la entrada
     *                                                          no es válida
     */
    public SchedulerSimulator(List<ProcessDescriptor> descriptors, SimulationConfig config) {
        this.descriptors = new ArrayList<>(descriptors != null ? descriptors : new ArrayList<>());
        this.config = config;
        ProcessStore validated = new ProcessStore(this.descriptors);
        validated.close();
        config.createAlgorithm();
        logger.debug("Validated {} processes for {}", validated.size(), config);
        if (config.isTraceEvents()) {
            listeners.add(event -> logger.info(event));
        }
    }

    /**
     * Registra un listener que recibirá los eventos de cada ejecución.
     *
     * @param listener listener de eventos
     */
    public void addEventListener(EventLogger.EventListener listener) {
        listeners.add(listener);
    }

    /**
     * Ejecuta la simulación hasta el final.
     *
     * @return informe de métricas
     */
    public SimulationReport run() {
        return newEngine().run();
    }

    /**
     * Crea un motor independiente con su propio almacén y algoritmo.
     *
     * @return motor listo para {@link SchedulerEngine#run()}
     */
    public SchedulerEngine newEngine() {
        ProcessStore store = new ProcessStore(descriptors);
        SchedulingAlgorithm algorithm = config.createAlgorithm();
        SchedulerEngine engine = new SchedulerEngine(store, algorithm, config.getCpuCount());
        for (EventLogger.EventListener listener : listeners) {
            engine.getEventLogger().addListener(listener);
        }
        return engine;
    }
}
