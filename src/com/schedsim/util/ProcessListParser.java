package com.schedsim.util;

import com.schedsim.process.ProcessDescriptor;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * ProcessListParser
 *
 * Utilidades para leer/escribir ficheros de procesos en formato simple.
 *
 * Formato por línea:
 * ID ARRIVAL BURST PRIORITY
 *
 * La prioridad es opcional (0 si se omite). Se ignoran líneas vacías y las
 * que empiezan por '#'. Los métodos usan try-with-resources para garantizar
 * el cierre de streams.
 */
public final class ProcessListParser {

    private ProcessListParser() {
    }

    /**
     * Parsea una lista de procesos desde un fichero.
     *
     * @param file ruta del fichero a leer
     * @return lista de descriptores en el orden del fichero
     * @throws IOException si ocurre un error de I/O o una línea no es válida
     */
    public static List<ProcessDescriptor> parse(Path file) throws IOException {
        List<ProcessDescriptor> processes = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                processes.add(parseProcessLine(line, file, lineNumber));
            }
        }

        return processes;
    }

    /**
     * Parsea una línea que describe un proceso.
     *
     * @param line       línea con formato: ID ARRIVAL BURST [PRIORITY]
     * @param file       fichero de origen (para el mensaje de error)
     * @param lineNumber número de línea (para el mensaje de error)
     * @return descriptor creado
     * @throws IOException si faltan campos o no son números
     */
    private static ProcessDescriptor parseProcessLine(String line, Path file, int lineNumber) throws IOException {
        String[] parts = line.split("\\s+");
        if (parts.length < 3 || parts.length > 4) {
            throw new IOException(file + ":" + lineNumber + ": expected 'ID ARRIVAL BURST [PRIORITY]' but got '"
                    + line + "'");
        }

        try {
            int id = Integer.parseInt(parts[0]);
            int arrivalTime = Integer.parseInt(parts[1]);
            int burstTime = Integer.parseInt(parts[2]);
            int priority = parts.length == 4 ? Integer.parseInt(parts[3]) : 0;
            return new ProcessDescriptor(id, arrivalTime, burstTime, priority);
        } catch (NumberFormatException e) {
            throw new IOException(file + ":" + lineNumber + ": " + e.getMessage(), e);
        }
    }

    /**
     * Escribe los procesos en el formato que lee {@link #parse(Path)}.
     *
     * @param file      fichero destino (se sobrescribe)
     * @param processes procesos a escribir
     * @throws IOException si ocurre un error de I/O
     */
    public static void write(Path file, List<ProcessDescriptor> processes) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file)) {
            writer.write("# ID ARRIVAL BURST PRIORITY");
            writer.newLine();
            for (ProcessDescriptor p : processes) {
                writer.write(p.getId() + " " + p.getArrivalTime() + " " + p.getBurstTime() + " " + p.getPriority());
                writer.newLine();
            }
        }
    }
}
