package com.schedsim.simulator;

import static org.junit.jupiter.api.Assertions.*;

import com.schedsim.exception.IncompleteSimulationException;
import com.schedsim.process.ProcessDescriptor;
import com.schedsim.process.ProcessRuntime;
import java.util.List;
import org.junit.jupiter.api.Test;

public class MetricsCalculatorTest {

    /**
     * Ejecuta un proceso de forma contigua entre start y start + burst.
     */
    private static ProcessRuntime finished(int id, int arrival, int burst, int start) {
        ProcessRuntime p = new ProcessRuntime(ProcessDescriptor.of(id, arrival, burst));
        p.markReady(arrival, id);
        p.markRunning(start);
        for (int t = start; t < start + burst; t++) {
            p.executeTick(t);
        }
        p.markTerminated(start + burst);
        return p;
    }

    @Test
    void testPerProcessMetrics() {
        List<ProcessRuntime> processes = List.of(finished(1, 0, 5, 0), finished(2, 1, 3, 5));
        SimulationReport report = MetricsCalculator.calculate("FCFS", processes, 1, 8, 0, 1,
                List.of(new ExecutionSlice(1, 0, 5), new ExecutionSlice(2, 5, 8)));

        ProcessMetrics p2 = report.getProcess(2);
        assertEquals(8, p2.getCompletionTime());
        assertEquals(7, p2.getTurnaroundTime());
        assertEquals(4, p2.getWaitingTime());
        assertEquals(4, p2.getResponseTime());
        assertEquals(6.0, report.getAverageTurnaroundTime(), 1e-9);
        assertEquals(2.0, report.getAverageResponseTime(), 1e-9);
        assertEquals(0.25, report.getThroughput(), 1e-9);
        assertEquals("FCFS", report.getPolicyName());
    }

    @Test
    void testUtilizationCountsIdleTicks() {
        SimulationReport report = MetricsCalculator.calculate("FCFS", List.of(finished(1, 2, 3, 2)), 1, 5, 2, 0,
                List.of(new ExecutionSlice(1, 2, 5)));

        assertEquals(0.6, report.getCpuUtilization(), 1e-9);
        assertEquals(3, report.getBusyTicks());
    }

    @Test
    void testUtilizationIsSharedAcrossCpus() {
        List<ProcessRuntime> processes = List.of(finished(1, 0, 4, 0), finished(2, 0, 2, 0));
        List<ExecutionSlice> timeline = List.of(new ExecutionSlice(1, 0, 4, 0), new ExecutionSlice(2, 0, 2, 1));
        SimulationReport report = MetricsCalculator.calculate("FCFS", processes, 2, 4, 2, 1, timeline);

        assertEquals(0.75, report.getCpuUtilization(), 1e-9);
        assertEquals(6, report.getBusyTicks());
        assertEquals(0.5, report.getThroughput(), 1e-9);
        assertEquals(2, report.getCpuCount());
    }

    @Test
    void testIncompleteProcessIsRejected() {
        ProcessRuntime pending = new ProcessRuntime(ProcessDescriptor.of(1, 0, 4));
        pending.markReady(0, 0);

        assertThrows(IncompleteSimulationException.class,
                () -> MetricsCalculator.calculate("FCFS", List.of(pending), 1, 0, 0, 0, List.of()));
    }

    @Test
    void testEmptyRunIsZeroSafe() {
        SimulationReport report = MetricsCalculator.calculate("FCFS", List.of(), 1, 0, 0, 0, List.of());

        assertEquals(0.0, report.getAverageWaitingTime());
        assertEquals(0.0, report.getAverageTurnaroundTime());
        assertEquals(0.0, report.getAverageResponseTime());
        assertEquals(0.0, report.getCpuUtilization());
        assertEquals(0.0, report.getThroughput());
    }

    @Test
    void testCalculationIsIdempotent() {
        List<ProcessRuntime> processes = List.of(finished(1, 0, 2, 0), finished(2, 0, 2, 2));
        List<ExecutionSlice> timeline = List.of(new ExecutionSlice(1, 0, 2), new ExecutionSlice(2, 2, 4));

        assertEquals(MetricsCalculator.calculate("FCFS", processes, 1, 4, 0, 1, timeline),
                MetricsCalculator.calculate("FCFS", processes, 1, 4, 0, 1, timeline));
    }

    @Test
    void testUnknownProcessLookup() {
        SimulationReport report = MetricsCalculator.calculate("FCFS", List.of(finished(1, 0, 1, 0)), 1, 1, 0, 0,
                List.of(new ExecutionSlice(1, 0, 1)));
        assertThrows(IllegalArgumentException.class, () -> report.getProcess(7));
    }
}
