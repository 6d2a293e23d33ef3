package com.schedsim.report;

import com.schedsim.simulator.ExecutionSlice;
import com.schedsim.simulator.SimulationReport;
import java.util.ArrayList;
import java.util.List;

/**
 * GanttTimeline
 *
 * Dibuja en texto la línea de tiempo de CPU de un informe. Cada tramo se
 * pinta como {@code |P<id>} seguido de relleno proporcional a su duración;
 * los huecos ociosos se pintan con '-'. Debajo se escribe la escala de
 * ticks en cada frontera.
 *
 * <pre>
 * |P1        |P2    |
 * 0          5      8
 * </pre>
 *
 * Con varias CPUs se dibuja una pareja de líneas por CPU, precedida de su
 * etiqueta ({@code CPU0:}, {@code CPU1:}...).
 */
public final class GanttTimeline {
    private static final int TICK_WIDTH = 2;

    private GanttTimeline() {
    }

    /**
     * Genera el diagrama de un informe.
     *
     * @param report informe de la simulación
     * @return barras y escala por CPU o "(empty timeline)"
     */
    public static String render(SimulationReport report) {
        if (report.getTimeline().isEmpty()) {
            return "(empty timeline)";
        }
        if (report.getCpuCount() == 1) {
            return renderRow(report.getTimeline(), report.getTotalTicks());
        }

        List<String> rows = new ArrayList<>();
        for (int cpu = 0; cpu < report.getCpuCount(); cpu++) {
            List<ExecutionSlice> slices = new ArrayList<>();
            for (ExecutionSlice slice : report.getTimeline()) {
                if (slice.getCpu() == cpu) {
                    slices.add(slice);
                }
            }
            rows.add("CPU" + cpu + ":");
            rows.add(renderRow(slices, report.getTotalTicks()));
        }
        return String.join(System.lineSeparator(), rows);
    }

    private static String renderRow(List<ExecutionSlice> slices, int totalTicks) {
        StringBuilder bars = new StringBuilder();
        StringBuilder scale = new StringBuilder();
        int cursor = 0;
        for (ExecutionSlice slice : slices) {
            if (slice.getStart() > cursor) {
                appendSegment(bars, scale, "", cursor, slice.getStart(), '-');
            }
            appendSegment(bars, scale, "P" + slice.getProcessId(), slice.getStart(), slice.getEnd(), ' ');
            cursor = slice.getEnd();
        }
        if (totalTicks > cursor) {
            appendSegment(bars, scale, "", cursor, totalTicks, '-');
            cursor = totalTicks;
        }
        bars.append('|');
        scale.append(cursor);
        return bars + System.lineSeparator() + scale;
    }

    private static void appendSegment(StringBuilder bars, StringBuilder scale, String label,
            int start, int end, char fill) {
        int width = Math.max(label.length() + 1, (end - start) * TICK_WIDTH);
        bars.append('|').append(label);
        for (int i = label.length(); i < width; i++) {
            bars.append(fill);
        }
        String tick = String.valueOf(start);
        scale.append(tick);
        for (int i = tick.length(); i <= width; i++) {
            scale.append(' ');
        }
    }
}
