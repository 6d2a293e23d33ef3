package com.schedsim.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.schedsim.process.ProcessDescriptor;
import com.schedsim.scheduling.SchedulingPolicy;
import com.schedsim.simulator.PolicyComparison;
import com.schedsim.simulator.SchedulerSimulator;
import com.schedsim.simulator.SimulationConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ReportPrinterTest {

    private static final List<ProcessDescriptor> PROCESSES = List.of(
            new ProcessDescriptor(1, 0, 5, 3),
            new ProcessDescriptor(2, 1, 3, 1),
            new ProcessDescriptor(3, 12, 2, 2));

    @Test
    void testFormat() {
        String text = ReportPrinter.format(
                new SchedulerSimulator(PROCESSES, new SimulationConfig(SchedulingPolicy.FCFS)).run());

        assertThat(text)
                .startsWith("Policy: FCFS (First Come, First Served)")
                .contains("Average Waiting Time: 1.33")
                .contains("Average Turnaround Time: 4.67")
                .contains("CPU Utilization: 71.43%")
                .contains("Throughput: 0.2143 processes/tick")
                .contains("Total Ticks: 14 (idle 4)")
                .contains("Context Switches: 2")
                .contains("CPUs: 1");
        assertThat(text.lines().filter(line -> line.matches("P\\d+ .*")).count()).isEqualTo(3);
    }

    @Test
    void testFormatComparison() throws InterruptedException {
        String text = ReportPrinter.formatComparison(new PolicyComparison(PROCESSES,
                new SimulationConfig(SchedulingPolicy.FCFS)).run());

        assertThat(text.lines()).hasSize(SchedulingPolicy.values().length + 1);
        assertThat(text).contains("Round Robin", "Priority (non-preemptive)", "SRTF");
    }
}
