package com.schedsim.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.schedsim.exception.DuplicateProcessIdException;
import com.schedsim.exception.InvalidCpuCountException;
import com.schedsim.exception.InvalidBurstTimeException;
import com.schedsim.exception.InvalidQuantumException;
import com.schedsim.exception.TickOverflowException;
import com.schedsim.process.ProcessDescriptor;
import com.schedsim.scheduling.SchedulingPolicy;
import com.schedsim.util.WorkloadGenerator;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class SchedulerSimulatorTest {

    private static final List<ProcessDescriptor> WORKLOAD =
            new WorkloadGenerator(1, 8, 0, 4).generate(25, 7L);

    @Test
    void testDuplicateIdFailsBeforeRunning() {
        List<ProcessDescriptor> processes = List.of(ProcessDescriptor.of(1, 0, 2), ProcessDescriptor.of(1, 3, 2));
        assertThrows(DuplicateProcessIdException.class,
                () -> new SchedulerSimulator(processes, new SimulationConfig(SchedulingPolicy.FCFS)));
    }

    @Test
    void testZeroBurstFailsBeforeRunning() {
        List<ProcessDescriptor> processes = List.of(ProcessDescriptor.of(1, 0, 0));
        assertThrows(InvalidBurstTimeException.class,
                () -> new SchedulerSimulator(processes, new SimulationConfig(SchedulingPolicy.SJN)));
    }

    @Test
    void testInvalidQuantumFailsBeforeRunning() {
        List<ProcessDescriptor> processes = List.of(ProcessDescriptor.of(1, 0, 2));
        assertThrows(InvalidQuantumException.class,
                () -> new SchedulerSimulator(processes, new SimulationConfig(SchedulingPolicy.ROUND_ROBIN, 0)));
    }

    @Test
    void testZeroCpusFailsBeforeRunning() {
        assertThrows(InvalidCpuCountException.class,
                () -> new SimulationConfig(SchedulingPolicy.FCFS, SimulationConfig.DEFAULT_QUANTUM, 0, false));
    }

    @Test
    void testWorkloadBeyondTickRangeFailsBeforeRunning() {
        List<ProcessDescriptor> processes = List.of(ProcessDescriptor.of(1, 2, Integer.MAX_VALUE - 1));
        assertThrows(TickOverflowException.class,
                () -> new SchedulerSimulator(processes, new SimulationConfig(SchedulingPolicy.FCFS)));
    }

    @Test
    void testSameInputSameReport() {
        SimulationConfig config = new SimulationConfig(SchedulingPolicy.ROUND_ROBIN, 3);
        SimulationReport first = new SchedulerSimulator(WORKLOAD, config).run();
        SimulationReport second = new SchedulerSimulator(WORKLOAD, config).run();

        assertEquals(first, second);
    }

    @Test
    void testListenerReceivesEvents() {
        List<String> received = new ArrayList<>();
        SchedulerSimulator simulator = new SchedulerSimulator(List.of(ProcessDescriptor.of(1, 0, 2)),
                new SimulationConfig(SchedulingPolicy.FCFS));
        simulator.addEventListener(received::add);
        simulator.run();

        assertThat(received).first().isEqualTo("[T=0] Simulator started (FCFS (First Come, First Served))");
        assertThat(received).last().isEqualTo("[T=2] Simulation complete");
    }

    @Test
    void testInputListIsCopied() {
        List<ProcessDescriptor> processes = new ArrayList<>(List.of(ProcessDescriptor.of(1, 0, 2)));
        SchedulerSimulator simulator = new SchedulerSimulator(processes, new SimulationConfig(SchedulingPolicy.FCFS));
        processes.add(ProcessDescriptor.of(2, 0, 0));

        assertEquals(1, simulator.run().getProcessCount());
    }

    @ParameterizedTest
    @EnumSource(SchedulingPolicy.class)
    void testEveryPolicyHonoursTimingInvariants(SchedulingPolicy policy) {
        assertTimingInvariants(new SchedulerSimulator(WORKLOAD, new SimulationConfig(policy, 2)).run());
    }

    @ParameterizedTest
    @EnumSource(SchedulingPolicy.class)
    void testEveryPolicyHonoursTimingInvariantsOnThreeCpus(SchedulingPolicy policy) {
        SimulationReport report = new SchedulerSimulator(WORKLOAD,
                new SimulationConfig(policy, 2, 3, false)).run();

        assertEquals(3, report.getCpuCount());
        assertTimingInvariants(report);
    }

    private static void assertTimingInvariants(SimulationReport report) {
        int totalBurst = 0;
        for (ProcessDescriptor d : WORKLOAD) {
            ProcessMetrics m = report.getProcess(d.getId());
            assertTrue(m.getCompletionTime() >= d.getArrivalTime() + d.getBurstTime(), m.toString());
            assertTrue(m.getWaitingTime() >= 0, m.toString());
            assertTrue(m.getResponseTime() >= 0, m.toString());
            assertTrue(m.getResponseTime() <= m.getWaitingTime(), m.toString());
            totalBurst += d.getBurstTime();
        }
        assertEquals(totalBurst, report.getBusyTicks());
        assertEquals(WORKLOAD.size(), report.getProcessCount());

        int covered = 0;
        for (ExecutionSlice slice : report.getTimeline()) {
            assertTrue(slice.length() > 0, slice.toString());
            covered += slice.length();
        }
        assertEquals(totalBurst, covered);

        for (int cpu = 0; cpu < report.getCpuCount(); cpu++) {
            int previousEnd = 0;
            for (ExecutionSlice slice : report.getTimeline()) {
                if (slice.getCpu() == cpu) {
                    assertTrue(slice.getStart() >= previousEnd, slice.toString());
                    previousEnd = slice.getEnd();
                }
            }
        }
    }
}
