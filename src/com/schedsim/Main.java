package com.schedsim;

import com.schedsim.process.ProcessDescriptor;
import com.schedsim.report.GanttTimeline;
import com.schedsim.report.ReportPrinter;
import com.schedsim.scheduling.SchedulingPolicy;
import com.schedsim.simulator.PolicyComparison;
import com.schedsim.simulator.SchedulerSimulator;
import com.schedsim.simulator.SimulationConfig;
import com.schedsim.simulator.SimulationReport;
import com.schedsim.util.ProcessListParser;
import com.schedsim.util.WorkloadGenerator;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/**
 * Main
 *
 * Línea de comandos del simulador: carga o genera una lista de procesos,
 * ejecuta una política (o todas con --compare) e imprime el informe.
 */
@CommandLine.Command(name = "schedsim",
        mixinStandardHelpOptions = true,
        version = "schedsim 1.0.0",
        headerHeading = "Usage:%n%n",
        synopsisHeading = "%n",
        descriptionHeading = "%nDescription%n%n",
        optionListHeading = "%nOptions:%n",
        header = "Simulate CPU scheduling policies over a process list",
        description = "Reads processes from a file (one 'ID ARRIVAL BURST [PRIORITY]' per line)\n"
                + "or generates a reproducible random workload, runs the selected policy and\n"
                + "prints per-process and aggregate metrics.",
        exitCodeListHeading = "Exit Codes:%n",
        exitCodeList = {
                "0: simulation completed",
                "1: invalid input or configuration"
        })
public class Main implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(Main.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private Source source;

    static class Source {
        @CommandLine.Option(names = {"-f", "--file"}, description = "Process list file")
        private Path file;

        @CommandLine.Option(names = {"-g", "--generate"}, description = "Generate N random processes")
        private Integer generate;
    }

    @CommandLine.Option(names = {"-p", "--policy"}, defaultValue = "fcfs",
            description = "fcfs, sjn, srtf, rr, priority, priority-np (default: ${DEFAULT-VALUE})")
    private String policy;

    @CommandLine.Option(names = {"-q", "--quantum"}, defaultValue = "" + SimulationConfig.DEFAULT_QUANTUM,
            description = "Round-Robin quantum in ticks (default: ${DEFAULT-VALUE})")
    private int quantum;

    @CommandLine.Option(names = {"-c", "--cpus"}, defaultValue = "" + SimulationConfig.DEFAULT_CPU_COUNT,
            description = "Number of CPUs sharing the Ready queue (default: ${DEFAULT-VALUE})")
    private int cpus;

    @CommandLine.Option(names = {"--compare"}, description = "Run every policy and print a comparison table")
    private boolean compare;

    @CommandLine.Option(names = {"--gantt"}, description = "Print the CPU timeline")
    private boolean gantt;

    @CommandLine.Option(names = {"--trace"}, description = "Log every scheduling event")
    private boolean trace;

    @CommandLine.Option(names = {"--seed"}, defaultValue = "42", description = "Seed for --generate")
    private long seed;

    @CommandLine.Option(names = {"--burst-min"}, defaultValue = "1", description = "Minimum generated burst")
    private int burstMin;

    @CommandLine.Option(names = {"--burst-max"}, defaultValue = "10", description = "Maximum generated burst")
    private int burstMax;

    @CommandLine.Option(names = {"--gap-min"}, defaultValue = "0",
            description = "Minimum ticks between generated arrivals")
    private int gapMin;

    @CommandLine.Option(names = {"--gap-max"}, defaultValue = "3",
            description = "Maximum ticks between generated arrivals")
    private int gapMax;

    @CommandLine.Option(names = {"--save"}, description = "Write the process list used to this file")
    private Path save;

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            List<ProcessDescriptor> processes = loadProcesses();
            if (save != null) {
                ProcessListParser.write(save, processes);
                logger.info("Wrote {} processes to {}", processes.size(), save);
            }

            if (compare) {
                SimulationConfig config = new SimulationConfig(SchedulingPolicy.FCFS, quantum, cpus, trace);
                Map<SchedulingPolicy, SimulationReport> reports = new PolicyComparison(processes, config).run();
                out.print(ReportPrinter.formatComparison(reports));
            } else {
                SimulationConfig config = new SimulationConfig(SchedulingPolicy.fromName(policy), quantum, cpus,
                        trace);
                SimulationReport report = new SchedulerSimulator(processes, config).run();
                out.print(ReportPrinter.format(report));
                if (gantt) {
                    out.println();
                    out.println(GanttTimeline.render(report));
                }
            }
            out.flush();
            return 0;
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid simulation input: {}", e.getMessage());
            err.println("error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Could not read or write process list", e);
            err.println("error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("error: interrupted");
            return 1;
        }
    }

    private List<ProcessDescriptor> loadProcesses() throws IOException {
        if (source.file != null) {
            List<ProcessDescriptor> processes = ProcessListParser.parse(source.file);
            logger.info("Loaded {} processes from {}", processes.size(), source.file);
            return processes;
        }
        WorkloadGenerator generator = new WorkloadGenerator(burstMin, burstMax, gapMin, gapMax);
        return generator.generate(source.generate, seed);
    }
}
