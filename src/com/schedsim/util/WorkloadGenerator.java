package com.schedsim.util;

import com.schedsim.process.ProcessDescriptor;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * WorkloadGenerator
 *
 * Genera cargas sintéticas reproducibles: con la misma semilla se obtiene la
 * misma lista de procesos. Los ids son consecutivos desde 1, las llegadas se
 * separan por un hueco aleatorio y la prioridad se toma en [1, 10].
 */
public class WorkloadGenerator {
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    private final int burstMin;
    private final int burstMax;
    private final int gapMin;
    private final int gapMax;

    /**
     * @param burstMin ráfaga mínima (al menos 1)
     * @param burstMax ráfaga máxima (no menor que burstMin)
     * @param gapMin   hueco mínimo entre llegadas consecutivas (al menos 0)
     * @param gapMax   hueco máximo entre llegadas consecutivas
     */
    public WorkloadGenerator(int burstMin, int burstMax, int gapMin, int gapMax) {
        if (burstMin < 1) {
            throw new IllegalArgumentException("burstMin must be >= 1");
        }
        if (burstMax < burstMin) {
            throw new IllegalArgumentException("burstMax must be >= burstMin");
        }
        if (gapMin < 0 || gapMax < gapMin) {
            throw new IllegalArgumentException("arrival gap range must satisfy 0 <= gapMin <= gapMax");
        }
        this.burstMin = burstMin;
        this.burstMax = burstMax;
        this.gapMin = gapMin;
        this.gapMax = gapMax;
    }

    /**
     * Genera {@code count} procesos.
     *
     * @param count número de procesos
     * @param seed  semilla del generador
     * @return descriptores ordenados por llegada
     */
    public List<ProcessDescriptor> generate(int count, long seed) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        List<ProcessDescriptor> processes = new ArrayList<>(count);
        int arrival = 0;
        for (int id = 1; id <= count; id++) {
            if (id > 1) {
                arrival += between(rng, gapMin, gapMax);
            }
            int burst = between(rng, burstMin, burstMax);
            int priority = between(rng, MIN_PRIORITY, MAX_PRIORITY);
            processes.add(new ProcessDescriptor(id, arrival, burst, priority));
        }
        return processes;
    }

    private static int between(UniformRandomProvider rng, int min, int max) {
        return min + rng.nextInt(max - min + 1);
    }
}
