package com.schedsim.report;

import com.schedsim.scheduling.SchedulingPolicy;
import com.schedsim.simulator.ProcessMetrics;
import com.schedsim.simulator.SimulationReport;
import java.util.Locale;
import java.util.Map;

/**
 * ReportPrinter
 *
 * Formatea informes de simulación como tablas de texto. Solo lee el
 * {@link SimulationReport}; no conoce el motor.
 */
public final class ReportPrinter {
    private static final String NL = System.lineSeparator();

    private ReportPrinter() {
    }

    /**
     * Tabla por proceso seguida de las métricas agregadas.
     *
     * @param report informe a formatear
     * @return texto multilínea
     */
    public static String format(SimulationReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Policy: ").append(report.getPolicyName()).append(NL).append(NL);
        sb.append(String.format(Locale.ROOT, "%-6s %8s %6s %9s %10s %11s %8s %11s %9s%n",
                "PID", "Arrival", "Burst", "Priority", "First run", "Completion",
                "Waiting", "Turnaround", "Response"));
        for (ProcessMetrics m : report.getProcesses()) {
            sb.append(String.format(Locale.ROOT, "%-6s %8d %6d %9d %10d %11d %8d %11d %9d%n",
                    "P" + m.getProcessId(), m.getArrivalTime(), m.getBurstTime(), m.getPriority(),
                    m.getFirstRunTime(), m.getCompletionTime(), m.getWaitingTime(),
                    m.getTurnaroundTime(), m.getResponseTime()));
        }
        sb.append(NL);
        sb.append(String.format(Locale.ROOT, "Average Waiting Time: %.2f%n", report.getAverageWaitingTime()));
        sb.append(String.format(Locale.ROOT, "Average Turnaround Time: %.2f%n", report.getAverageTurnaroundTime()));
        sb.append(String.format(Locale.ROOT, "Average Response Time: %.2f%n", report.getAverageResponseTime()));
        sb.append(String.format(Locale.ROOT, "CPU Utilization: %.2f%%%n", report.getCpuUtilization() * 100));
        sb.append(String.format(Locale.ROOT, "Throughput: %.4f processes/tick%n", report.getThroughput()));
        sb.append("Total Ticks: ").append(report.getTotalTicks())
                .append(" (idle ").append(report.getIdleTicks()).append(")").append(NL);
        sb.append("Context Switches: ").append(report.getContextSwitches()).append(NL);
        sb.append("CPUs: ").append(report.getCpuCount()).append(NL);
        return sb.toString();
    }

    /**
     * Una fila de agregados por política.
     *
     * @param reports informes por política
     * @return tabla comparativa
     */
    public static String formatComparison(Map<SchedulingPolicy, SimulationReport> reports) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-26s %9s %11s %9s %8s %11s %9s%n",
                "Policy", "Avg wait", "Avg turnar.", "Avg resp.", "CPU %", "Throughput", "Switches"));
        for (Map.Entry<SchedulingPolicy, SimulationReport> entry : reports.entrySet()) {
            SimulationReport r = entry.getValue();
            sb.append(String.format(Locale.ROOT, "%-26s %9.2f %11.2f %9.2f %8.2f %11.4f %9d%n",
                    entry.getKey().getDisplayName(), r.getAverageWaitingTime(), r.getAverageTurnaroundTime(),
                    r.getAverageResponseTime(), r.getCpuUtilization() * 100, r.getThroughput(),
                    r.getContextSwitches()));
        }
        return sb.toString();
    }
}
