/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.RunFunPuzz;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tablecp.csp.examples.funpuzz.FunPuzz;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RunFunPuzzTest {

    @Test
    public void testRunAppendsStatistics(@TempDir Path dir) throws IOException, URISyntaxException {
        String instance = Path.of(getClass().getResource("/funpuzz/puzzle3.json").toURI()).toString();
        Path csv = dir.resolve("stats.csv");

        RunFunPuzz.main(new String[]{instance, "FC", "caged", "static", csv.toString()});
        RunFunPuzz.main(new String[]{instance, "GAC", "caged", "mrv", csv.toString()});

        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals("Instance,Propagator,Model,Nodes,Failures,Solutions,Prunings,Completed,TimeMillis", lines.get(0));
        String[] fc = lines.get(1).split(",");
        assertEquals("FC", fc[1]);
        assertEquals("caged", fc[2]);
        assertEquals("1", fc[5]);
        assertEquals("false", fc[7]);
        assertEquals("GAC", lines.get(2).split(",")[1]);
    }

    @Test
    public void testBuildModel() {
        FunPuzz puzzle = new FunPuzz(3, List.of());
        assertEquals(18, RunFunPuzz.buildModel(puzzle, "binary").csp().allConstraints().size());
        assertEquals(6, RunFunPuzz.buildModel(puzzle, "NARY").csp().allConstraints().size());
        assertEquals(18, RunFunPuzz.buildModel(puzzle, "caged").csp().allConstraints().size());
        assertThrows(IllegalArgumentException.class, () -> RunFunPuzz.buildModel(puzzle, "sudoku"));
    }
}
