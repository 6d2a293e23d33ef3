package com.schedsim.report;

import static org.junit.jupiter.api.Assertions.*;

import com.schedsim.process.ProcessDescriptor;
import com.schedsim.scheduling.SchedulingPolicy;
import com.schedsim.simulator.SchedulerSimulator;
import com.schedsim.simulator.SimulationConfig;
import com.schedsim.simulator.SimulationReport;
import java.util.List;
import org.junit.jupiter.api.Test;

public class GanttTimelineTest {

    private static SimulationReport fcfs(ProcessDescriptor... processes) {
        return new SchedulerSimulator(List.of(processes), new SimulationConfig(SchedulingPolicy.FCFS)).run();
    }

    @Test
    void testContiguousSlices() {
        String chart = GanttTimeline.render(fcfs(ProcessDescriptor.of(1, 0, 5), ProcessDescriptor.of(2, 1, 3)));

        assertEquals("|P1        |P2    |" + System.lineSeparator() + "0          5      8", chart);
    }

    @Test
    void testIdleGapIsDashed() {
        String chart = GanttTimeline.render(fcfs(
                new ProcessDescriptor(1, 0, 5, 3),
                new ProcessDescriptor(2, 1, 3, 1),
                new ProcessDescriptor(3, 12, 2, 2)));

        assertEquals("|P1        |P2    |--------|P3  |" + System.lineSeparator()
                + "0          5      8        12   14", chart);
    }

    @Test
    void testOneRowPerCpu() {
        SimulationReport report = new SchedulerSimulator(
                List.of(ProcessDescriptor.of(1, 0, 5), ProcessDescriptor.of(2, 1, 3), ProcessDescriptor.of(3, 2, 2)),
                new SimulationConfig(SchedulingPolicy.FCFS, SimulationConfig.DEFAULT_QUANTUM, 2, false)).run();
        String nl = System.lineSeparator();

        assertEquals("CPU0:" + nl
                + "|P1        |--|" + nl
                + "0          5  6" + nl
                + "CPU1:" + nl
                + "|--|P2    |P3  |" + nl
                + "0  1      4    6", GanttTimeline.render(report));
    }

    @Test
    void testEmptyTimeline() {
        assertEquals("(empty timeline)", GanttTimeline.render(fcfs()));
    }
}
