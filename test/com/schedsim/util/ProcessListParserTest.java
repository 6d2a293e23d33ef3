package com.schedsim.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.schedsim.process.ProcessDescriptor;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ProcessListParserTest {

    @TempDir
    Path tempDir;

    static Path fixture(String name) throws URISyntaxException {
        return Paths.get(ProcessListParserTest.class.getResource("/fixtures/" + name).toURI());
    }

    @Test
    void testParseSkipsBlankAndCommentLines() throws Exception {
        List<ProcessDescriptor> processes = ProcessListParser.parse(fixture("processes.txt"));

        assertThat(processes).containsExactly(
                new ProcessDescriptor(1, 0, 5, 3),
                new ProcessDescriptor(2, 1, 3, 1),
                new ProcessDescriptor(3, 12, 2, 2));
    }

    @Test
    void testMalformedLineReportsLocation() throws Exception {
        Path file = fixture("malformed.txt");
        IOException e = assertThrows(IOException.class, () -> ProcessListParser.parse(file));
        assertThat(e.getMessage()).contains("malformed.txt:2");
    }

    @Test
    void testPriorityIsOptional() throws IOException {
        Path file = tempDir.resolve("short.txt");
        Files.writeString(file, "4 2 7\n");

        assertEquals(List.of(ProcessDescriptor.of(4, 2, 7)), ProcessListParser.parse(file));
    }

    @Test
    void testWrongFieldCount() throws IOException {
        Path file = tempDir.resolve("fields.txt");
        Files.writeString(file, "1 0\n");

        IOException e = assertThrows(IOException.class, () -> ProcessListParser.parse(file));
        assertThat(e.getMessage()).contains("ID ARRIVAL BURST [PRIORITY]");
    }

    @Test
    void testWrittenFileParsesBack() throws IOException {
        Path file = tempDir.resolve("saved.txt");
        List<ProcessDescriptor> processes = new WorkloadGenerator(1, 9, 0, 2).generate(12, 3L);

        ProcessListParser.write(file, processes);

        assertThat(Files.readAllLines(file).get(0)).startsWith("#");
        assertEquals(processes, ProcessListParser.parse(file));
    }
}
