package com.schedsim.simulator;

import com.schedsim.process.ProcessDescriptor;
import com.schedsim.scheduling.SchedulingPolicy;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * PolicyComparison
 *
 * Ejecuta la misma carga con varias políticas a la vez. Cada tarea crea su
 * propio motor, con su almacén y su reloj; no hay estado mutable compartido
 * entre hilos.
 */
public class PolicyComparison {
    private static final Logger logger = LogManager.getLogger(PolicyComparison.class);

    private final int processCount;
    private final Map<SchedulingPolicy, SchedulerSimulator> simulators = new LinkedHashMap<>();

    /**
     * Compara todas las políticas soportadas.
     */
    public PolicyComparison(List<ProcessDescriptor> descriptors, SimulationConfig baseConfig) {
        this(descriptors, baseConfig, Arrays.asList(SchedulingPolicy.values()));
    }

    /**
     * @param descriptors procesos de la simulación
     * @param baseConfig  configuración común (quantum, traza)
     * @param policies    políticas a comparar, en el orden del resultado
     * @throws com.schedsim.exception.SimulationSetupException si la entrada no
     *                                                          es válida para alguna política
     */
    public PolicyComparison(List<ProcessDescriptor> descriptors, SimulationConfig baseConfig,
            List<SchedulingPolicy> policies) {
        this.processCount = descriptors.size();
        for (SchedulingPolicy policy : policies) {
            simulators.put(policy, new SchedulerSimulator(descriptors, baseConfig.withPolicy(policy)));
        }
    }

    /**
     * Ejecuta todas las simulaciones en paralelo y espera sus resultados.
     *
     * @return informes por política, en el orden solicitado
     * @throws InterruptedException si el hilo es interrumpido mientras espera
     */
    public Map<SchedulingPolicy, SimulationReport> run() throws InterruptedException {
        int threads = Math.max(1, Math.min(simulators.size(), Runtime.getRuntime().availableProcessors()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            Map<SchedulingPolicy, Future<SimulationReport>> futures = new LinkedHashMap<>();
            for (Map.Entry<SchedulingPolicy, SchedulerSimulator> entry : simulators.entrySet()) {
                Callable<SimulationReport> task = entry.getValue()::run;
                futures.put(entry.getKey(), executor.submit(task));
            }

            Map<SchedulingPolicy, SimulationReport> reports = new LinkedHashMap<>();
            for (Map.Entry<SchedulingPolicy, Future<SimulationReport>> entry : futures.entrySet()) {
                reports.put(entry.getKey(), await(entry.getValue()));
            }
            logger.info("Compared {} policies over {} processes", reports.size(), processCount);
            return reports;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Espera un resultado y relanza sin envolver los errores del motor.
     */
    private static SimulationReport await(Future<SimulationReport> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("simulation failed", cause);
        }
    }
}
