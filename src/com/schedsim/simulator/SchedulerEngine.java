package com.schedsim.simulator;

import com.schedsim.exception.InvalidCpuCountException;
import com.schedsim.exception.SchedulerInvariantException;
import com.schedsim.process.ProcessRuntime;
import com.schedsim.process.ProcessState;
import com.schedsim.process.ProcessStore;
import com.schedsim.scheduling.SchedulingAlgorithm;
import com.schedsim.scheduling.SchedulingDecision;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * SchedulerEngine
 *
 * Simulador orientado a ticks que coordina:
 * - llegada de procesos y su paso a la cola de listos,
 * - planificación (vía SchedulingAlgorithm) sobre una o varias CPUs,
 * - desalojo por fin de quantum o por la política,
 * - ejecución tick a tick y registro de marcas de tiempo.
 *
 * El reloj es un campo de la instancia: se pone a cero al entrar en
 * {@link #run()} y solo avanza dentro del bucle principal. Cada instancia
 * posee sus procesos, su cola y su reloj, por lo que varias simulaciones
 * pueden ejecutarse en paralelo con motores distintos.
 *
 * Con varias CPUs la política se consulta una vez por CPU libre, en orden de
 * índice, y todas comparten la misma cola de listos.
 */
public class SchedulerEngine {
    private static final Logger logger = LogManager.getLogger(SchedulerEngine.class);

    private final ProcessStore store;
    private final SchedulingAlgorithm scheduler;
    private final EventLogger eventLogger;
    private final Cpu[] cpus;

    private List<ProcessRuntime> allProcesses = new ArrayList<>();
    private final List<ProcessRuntime> readyQueue = new LinkedList<>();
    private final List<ExecutionSlice> timeline = new ArrayList<>();

    private int currentTime = 0;
    private long idleCpuTicks = 0;
    private int contextSwitches = 0;
    private long readySequence = 0;

    /**
     * Estado de una CPU: proceso en ejecución, asignación pendiente y tramo
     * abierto de la línea de tiempo.
     */
    private static final class Cpu {
        private final int index;
        private ProcessRuntime running;
        private int timeSliceRemaining;
        private int lastRunId;
        private int sliceOwner;
        private int sliceStart;
        private boolean idle;

        private Cpu(int index) {
            this.index = index;
            reset();
        }

        private void reset() {
            running = null;
            timeSliceRemaining = 0;
            lastRunId = ProcessRuntime.UNSET;
            sliceOwner = ProcessRuntime.UNSET;
            sliceStart = 0;
            idle = false;
        }
    }

    /**
     * Construye un motor de una sola CPU.
     *
     * @param store     descriptores de la simulación
     * @param scheduler algoritmo de planificación
     */
    public SchedulerEngine(ProcessStore store, SchedulingAlgorithm scheduler) {
        this(store, scheduler, 1);
    }

    /**
     * Construye un motor. Cierra la fase de registro del almacén.
     *
     * @param store     descriptores de la simulación
     * @param scheduler algoritmo de planificación
     * @param cpuCount  número de CPUs, al menos 1
     * @throws InvalidCpuCountException si cpuCount es menor que 1
     */
    public SchedulerEngine(ProcessStore store, SchedulingAlgorithm scheduler, int cpuCount) {
        if (cpuCount < 1) {
            throw new InvalidCpuCountException(cpuCount);
        }
        this.store = store;
        this.scheduler = scheduler;
        this.eventLogger = new EventLogger();
        this.cpus = new Cpu[cpuCount];
        for (int i = 0; i < cpuCount; i++) {
            cpus[i] = new Cpu(i);
        }
        store.close();
    }

    /**
     * Ejecuta la simulación hasta que todos los procesos terminan y devuelve
     * el informe de métricas. Cada llamada parte de cero.
     *
     * @return informe de la simulación
     * @throws SchedulerInvariantException si el bucle no termina dentro del
     *                                     límite teórico o se rompe un invariante
     */
    public SimulationReport run() {
        resetProcesses();
        final long tickLimit = store.getTotalBurstTime() + store.getMaxArrivalTime();
        logger.info("Simulation started: {} processes, policy {}, {} CPU(s)",
                allProcesses.size(), scheduler.getName(), cpus.length);
        eventLogger.log(currentTime, "Simulator started (" + scheduler.getName() + ")");

        while (!allProcessesTerminated()) {
            if (currentTime >= tickLimit) {
                throw new SchedulerInvariantException("simulation did not finish within " + tickLimit
                        + " ticks (" + scheduler.getName() + ")");
            }
            handleArrivals();
            for (Cpu cpu : cpus) {
                handleQuantumExpiry(cpu);
            }
            if (scheduler.isPreemptive()) {
                for (Cpu cpu : cpus) {
                    handlePreemption(cpu);
                }
            }
            for (Cpu cpu : cpus) {
                scheduleIfIdle(cpu);
            }

            for (Cpu cpu : cpus) {
                if (cpu.running == null) {
                    idleTick(cpu);
                } else {
                    executeCpuTick(cpu);
                }
            }
            currentTime++;
            for (Cpu cpu : cpus) {
                handleCompletion(cpu);
            }
        }

        return finalizeSimulation();
    }

    /**
     * Reinicia el estado de las estructuras internas y crea procesos nuevos.
     */
    private void resetProcesses() {
        allProcesses = store.createRuntimes();
        readyQueue.clear();
        timeline.clear();
        eventLogger.clear();
        for (Cpu cpu : cpus) {
            cpu.reset();
        }
        currentTime = 0;
        idleCpuTicks = 0;
        contextSwitches = 0;
        readySequence = 0;
    }

    /**
     * Pasa a READY los procesos NEW cuyo arrivalTime ya se alcanzó.
     */
    private void handleArrivals() {
        for (ProcessRuntime p : allProcesses) {
            if (p.getState() == ProcessState.NEW && p.getArrivalTime() <= currentTime) {
                p.markReady(currentTime, readySequence++);
                readyQueue.add(p);
                eventLogger.log(currentTime, "P" + p.getId() + " arrived and moved to Ready queue");
            }
        }
    }

    /**
     * Devuelve a READY el proceso que agotó su asignación sin terminar. Se
     * invoca después de las llegadas del mismo tick, que quedan por delante en
     * la rotación.
     */
    private void handleQuantumExpiry(Cpu cpu) {
        if (cpu.running == null || cpu.timeSliceRemaining > 0) {
            return;
        }
        eventLogger.log(currentTime, "P" + cpu.running.getId() + " quantum expired, moved to Ready queue");
        returnRunningToReady(cpu);
    }

    /**
     * Con políticas con desalojo, consulta si el proceso en ejecución debe
     * ceder la CPU a otro de la cola de listos. El desalojado vuelve a la cola
     * en el acto y puede ocupar una CPU de índice mayor en la misma frontera.
     */
    private void handlePreemption(Cpu cpu) {
        if (cpu.running == null) {
            return;
        }
        SchedulingDecision decision = scheduler.selectNext(currentTime, readyView(), cpu.running);
        if (decision.isIdle()) {
            throw new SchedulerInvariantException(scheduler.getName()
                    + " returned Idle while P" + cpu.running.getId() + " is running");
        }
        if (decision.getSelectedId() == cpu.running.getId()) {
            return;
        }
        ProcessRuntime preempted = cpu.running;
        returnRunningToReady(cpu);
        eventLogger.log(currentTime, "P" + preempted.getId() + " preempted by P" + decision.getSelectedId()
                + where(cpu) + " (remaining " + preempted.getRemainingTime() + ")");
        dispatch(cpu, decision);
    }

    /**
     * Si la CPU está libre, invoca al scheduler para asignar siguiente proceso.
     */
    private void scheduleIfIdle(Cpu cpu) {
        if (cpu.running != null) {
            return;
        }
        SchedulingDecision decision = scheduler.selectNext(currentTime, readyView(), null);
        if (decision.isIdle()) {
            if (!readyQueue.isEmpty()) {
                throw new SchedulerInvariantException(scheduler.getName() + " returned Idle with "
                        + readyQueue.size() + " ready processes");
            }
            return;
        }
        dispatch(cpu, decision);
    }

    /**
     * Saca de la cola de listos el proceso elegido y lo pone en ejecución.
     *
     * @param cpu      CPU que recibe el proceso
     * @param decision decisión de la política
     */
    private void dispatch(Cpu cpu, SchedulingDecision decision) {
        ProcessRuntime candidate = findReady(decision.getSelectedId());
        if (decision.getAllottedTicks() > candidate.getRemainingTime()) {
            throw new SchedulerInvariantException("P" + candidate.getId() + " allotted "
                    + decision.getAllottedTicks() + " ticks but only " + candidate.getRemainingTime() + " remain");
        }
        readyQueue.remove(candidate);
        if (cpu.lastRunId != ProcessRuntime.UNSET && cpu.lastRunId != candidate.getId()) {
            contextSwitches++;
        }
        cpu.lastRunId = candidate.getId();

        cpu.running = candidate;
        candidate.markRunning(currentTime);
        cpu.timeSliceRemaining = decision.getAllottedTicks();

        eventLogger.log(currentTime, "P" + candidate.getId() + " started running (Burst: "
                + cpu.timeSliceRemaining + " units)" + where(cpu));
    }

    /**
     * Ejecuta un tick de CPU para el proceso en ejecución.
     */
    private void executeCpuTick(Cpu cpu) {
        if (cpu.sliceOwner != cpu.running.getId()) {
            closeSlice(cpu);
            cpu.sliceOwner = cpu.running.getId();
            cpu.sliceStart = currentTime;
        }
        cpu.idle = false;
        cpu.running.executeTick(currentTime);
        cpu.timeSliceRemaining--;
    }

    /**
     * Termina el proceso de la CPU si ya no le queda trabajo. Se invoca con el
     * reloj ya avanzado.
     */
    private void handleCompletion(Cpu cpu) {
        if (cpu.running == null || cpu.running.getRemainingTime() > 0) {
            return;
        }
        cpu.running.markTerminated(currentTime);
        eventLogger.log(currentTime, "P" + cpu.running.getId() + " terminated");
        cpu.running = null;
        cpu.timeSliceRemaining = 0;
    }

    /**
     * Cuenta un tick sin proceso en la CPU.
     */
    private void idleTick(Cpu cpu) {
        if (!cpu.idle) {
            eventLogger.log(currentTime, cpus.length == 1 ? "CPU idle" : "CPU" + cpu.index + " idle");
            cpu.idle = true;
        }
        closeSlice(cpu);
        idleCpuTicks++;
    }

    private void returnRunningToReady(Cpu cpu) {
        cpu.running.endCpuInterval(currentTime);
        cpu.running.markReady(currentTime, readySequence++);
        readyQueue.add(cpu.running);
        cpu.running = null;
        cpu.timeSliceRemaining = 0;
    }

    private void closeSlice(Cpu cpu) {
        if (cpu.sliceOwner != ProcessRuntime.UNSET) {
            timeline.add(new ExecutionSlice(cpu.sliceOwner, cpu.sliceStart, currentTime, cpu.index));
            cpu.sliceOwner = ProcessRuntime.UNSET;
        }
    }

    private String where(Cpu cpu) {
        return cpus.length == 1 ? "" : " on CPU" + cpu.index;
    }

    private ProcessRuntime findReady(int id) {
        for (ProcessRuntime p : readyQueue) {
            if (p.getId() == id) {
                return p;
            }
        }
        throw new SchedulerInvariantException(scheduler.getName() + " selected P" + id
                + " which is not in the Ready queue");
    }

    private List<ProcessRuntime> readyView() {
        return Collections.unmodifiableList(readyQueue);
    }

    /**
     * Cálculos finales y registro de métricas al terminar la simulación.
     *
     * @return informe final
     */
    private SimulationReport finalizeSimulation() {
        for (Cpu cpu : cpus) {
            closeSlice(cpu);
        }
        timeline.sort(ExecutionSlice.CHRONOLOGICAL);
        long busyCpuTicks = (long) cpus.length * currentTime - idleCpuTicks;
        if (busyCpuTicks != store.getTotalBurstTime()) {
            throw new SchedulerInvariantException("busy ticks " + busyCpuTicks + " differ from total burst time "
                    + store.getTotalBurstTime());
        }
        eventLogger.log(currentTime, "Simulation complete");
        SimulationReport report = MetricsCalculator.calculate(scheduler.getName(), allProcesses, cpus.length,
                currentTime, idleCpuTicks, contextSwitches, timeline);
        logger.info("Simulation finished at T={} (busy={}, idle={}, context switches={})",
                currentTime, busyCpuTicks, idleCpuTicks, contextSwitches);
        return report;
    }

    /**
     * Devuelve una copia de la lista de todos los procesos de la última
     * ejecución.
     *
     * @return lista de procesos
     */
    public List<ProcessRuntime> getAllProcesses() {
        return new ArrayList<>(allProcesses);
    }

    /**
     * Devuelve el EventLogger usado internamente.
     *
     * @return EventLogger
     */
    public EventLogger getEventLogger() {
        return eventLogger;
    }

    public int getCpuCount() {
        return cpus.length;
    }

    /**
     * Comprueba si todos los procesos han terminado.
     *
     * @return true si todos los procesos están en estado TERMINATED
     */
    private boolean allProcessesTerminated() {
        return allProcesses.stream().allMatch(ProcessRuntime::isComplete);
    }
}
