package io.github.manjago.automaton.debug;

import io.github.manjago.automaton.core.GraphBuilder;
import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.RuleParser;
import io.github.manjago.automaton.core.TransitionGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DotExporter.
 */
class DotExporterTest {

    private TransitionGraph graph;

    @BeforeEach
    void setUp() throws Exception {
        graph = new GraphBuilder().build(new RuleParser().parse("""
            1] left (a,2) (b,3) (x,5)
            2] accept
            3] reject
            """));
    }

    @Test
    @DisplayName("Two-way labels carry the direction")
    void testTwoWay() {
        String dot = new DotExporter(MachineKind.TWO_WAY).render(graph);

        assertTrue(dot.startsWith("digraph FSM {\n  rankdir=LR;"));
        assertTrue(dot.contains("  1 [label=\"1\\n[Scan,L]\", shape=circle];\n"));
        assertTrue(dot.contains("  2 [label=\"2\\n[Scan,R]\", shape=doublecircle, color=\"green\"];\n"));
        assertTrue(dot.contains("  3 [label=\"3\\n[Scan,R]\", shape=octagon, color=\"red\"];\n"));
        assertTrue(dot.contains("  1 -> 2 [label=\"a\"];\n"));
        assertTrue(dot.contains("  1 -> 5 [label=\"x\"];\n"));
        assertFalse(dot.contains("  5 ["), "isolated state is omitted");
        assertTrue(dot.endsWith("}\n"));
    }

    @Test
    @DisplayName("One-way labels show the action only")
    void testOneWay() {
        String dot = new DotExporter(MachineKind.PUSHDOWN).render(graph);

        assertTrue(dot.contains("  1 [label=\"1\\n[Scan]\", shape=circle];\n"));
    }

    @Test
    @DisplayName("Write creates parent directories")
    void testWrite(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("dots/graph.dot");

        new DotExporter(MachineKind.TWO_WAY).write(graph, file);

        assertTrue(Files.exists(file));
        assertEquals(new DotExporter(MachineKind.TWO_WAY).render(graph), Files.readString(file));
    }
}
