package io.github.manjago.automaton.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Stepper: one step at a time, per kind.
 */
class StepperTest {

    private static TransitionGraph build(String rules) throws Exception {
        return new GraphBuilder().build(new RuleParser().parse(rules));
    }

    @Nested
    @DisplayName("Two-way and Turing")
    class TwoWay {

        @Test
        @DisplayName("Head moves by the direction of the entered state")
        void testSuccessorDirection() throws Exception {
            TransitionGraph graph = build("""
                1] right (a,2)
                2] left (b,1)
                """);
            Stepper stepper = new Stepper(graph);
            RuntimeContext ctx = new RuntimeContext(MachineKind.TWO_WAY, "#ab#");

            StepResult result = stepper.step(ctx, graph.start());

            assertEquals(StepResult.Outcome.CONTINUE, result.outcome());
            assertEquals(2, result.successorId());
            assertEquals('a', result.read());
            assertEquals(1, result.head());
            assertEquals(0, ctx.getHead());
        }

        @Test
        @DisplayName("Missing transition rejects without moving")
        void testMissingTransition() throws Exception {
            TransitionGraph graph = build("1] right (a,1)");
            RuntimeContext ctx = new RuntimeContext(MachineKind.TWO_WAY, "#b#");

            StepResult result = new Stepper(graph).step(ctx, graph.start());

            assertEquals(StepResult.Outcome.REJECT, result.outcome());
            assertNull(result.successor());
            assertEquals(-1, result.successorId());
            assertEquals(1, ctx.getHead());
        }

        @Test
        @DisplayName("Moving off the tape into a running state is an error")
        void testOutOfBounds() throws Exception {
            TransitionGraph graph = build("1] left (a,1) (#,1)");
            Stepper stepper = new Stepper(graph);
            RuntimeContext ctx = new RuntimeContext(MachineKind.TWO_WAY, "#a#");

            stepper.step(ctx, graph.start());
            assertEquals(0, ctx.getHead());

            MachineException e = assertThrows(MachineException.class, () -> stepper.step(ctx, graph.start()));
            assertEquals(MachineException.Kind.OUT_OF_BOUNDS, e.getKind());
            assertEquals(1, e.getStateId());
        }

        @Test
        @DisplayName("Entering a terminal state does not commit the head move")
        void testTerminalKeepsHead() throws Exception {
            TransitionGraph graph = build("""
                1] left (#,2)
                2] accept
                """);
            RuntimeContext ctx = new RuntimeContext(MachineKind.TWO_WAY, "##");
            ctx.setHead(0);

            StepResult result = new Stepper(graph).step(ctx, graph.start());

            assertEquals(StepResult.Outcome.ACCEPT, result.outcome());
            assertEquals(0, ctx.getHead());
        }

        @Test
        @DisplayName("Reject flag rejects on entry")
        void testRejectState() throws Exception {
            TransitionGraph graph = build("""
                1] scan (a,2)
                2] reject
                """);

            StepResult result = new Stepper(graph).step(new RuntimeContext(MachineKind.TWO_WAY, "#a#"), graph.start());

            assertEquals(StepResult.Outcome.REJECT, result.outcome());
            assertEquals(2, result.successorId());
        }

        @Test
        @DisplayName("Write-tape state overwrites the cell it reads")
        void testWriteTape() throws Exception {
            TransitionGraph graph = build("1] wtape:x (a,1)");
            RuntimeContext ctx = new RuntimeContext(MachineKind.TURING, "#aa#");

            new Stepper(graph).step(ctx, graph.start());

            assertEquals("#xa#", ctx.tapeContents());
            assertEquals(2, ctx.getHead());
        }

        @Test
        @DisplayName("Action outside the kind's storage is a programming error")
        void testNotPermitted() throws Exception {
            TransitionGraph graph = build("1] push (a,1)");
            RuntimeContext ctx = new RuntimeContext(MachineKind.TWO_WAY, "#a#");

            assertThrows(IllegalStateException.class, () -> new Stepper(graph).step(ctx, graph.start()));
        }
    }

    @Nested
    @DisplayName("Pushdown")
    class Pushdown {

        @Test
        @DisplayName("Gated push fires only on the gate symbol")
        void testGatedPush() throws Exception {
            TransitionGraph graph = build("1] push (a,1) (b,1)");
            Stepper stepper = new Stepper(graph);
            RuntimeContext ctx = new RuntimeContext(MachineKind.PUSHDOWN, "#ab#");

            stepper.step(ctx, graph.start());
            stepper.step(ctx, graph.start());

            assertEquals("a", RuntimeContext.render(ctx.stack1()));
            assertEquals(3, ctx.getHead());
        }

        @Test
        @DisplayName("Ungated push pushes the symbol read")
        void testUngatedPush() {
            State push = new State(1, Direction.RIGHT, Action.PUSH1, Symbols.NONE, Symbols.NONE, Symbols.NONE,
                    false, false, Map.of('a', 1, 'b', 1));
            TransitionGraph graph = TransitionGraph.of(List.of(push));
            Stepper stepper = new Stepper(graph);
            RuntimeContext ctx = new RuntimeContext(MachineKind.PUSHDOWN, "#ab#");

            assertDoesNotThrow(() -> {
                stepper.step(ctx, push);
                stepper.step(ctx, push);
            });

            assertEquals("ab", RuntimeContext.render(ctx.stack1()));
        }

        @Test
        @DisplayName("Boundary marker does not advance the head")
        void testStationaryOnBoundary() throws Exception {
            TransitionGraph graph = build("1] pop (#,1)");
            RuntimeContext ctx = new RuntimeContext(MachineKind.PUSHDOWN, "##");
            ctx.setHead(1);

            StepResult result = new Stepper(graph).step(ctx, graph.start());

            assertEquals(StepResult.Outcome.CONTINUE, result.outcome());
            assertEquals(1, ctx.getHead());
        }

        @Test
        @DisplayName("Pop on empty stack rejects under the reject policy")
        void testUnderflowRejects() throws Exception {
            TransitionGraph graph = build("1] pop (b,1)");
            RuntimeContext ctx = new RuntimeContext(MachineKind.PUSHDOWN, "#b#");

            StepResult result = new Stepper(graph, PopFailurePolicy.REJECT).step(ctx, graph.start());

            assertEquals(StepResult.Outcome.REJECT, result.outcome());
        }

        @Test
        @DisplayName("Pop on empty stack fails under the error policy")
        void testUnderflowError() throws Exception {
            TransitionGraph graph = build("1] pop (b,1)");
            RuntimeContext ctx = new RuntimeContext(MachineKind.PUSHDOWN, "#b#");
            Stepper stepper = new Stepper(graph, PopFailurePolicy.ERROR);

            MachineException e = assertThrows(MachineException.class, () -> stepper.step(ctx, graph.start()));
            assertEquals(MachineException.Kind.STACK_UNDERFLOW, e.getKind());
        }

        @Test
        @DisplayName("Gated pop with a different top is a mismatch")
        void testMismatch() throws Exception {
            State pop = new State(1, Direction.RIGHT, Action.POP1, Symbols.NONE, 'x', Symbols.NONE,
                    false, false, Map.of('b', 1));
            TransitionGraph graph = TransitionGraph.of(List.of(pop));
            RuntimeContext ctx = new RuntimeContext(MachineKind.PUSHDOWN, "#b#");
            ctx.stack1().push('y');

            MachineException e = assertThrows(MachineException.class,
                    () -> new Stepper(graph, PopFailurePolicy.ERROR).step(ctx, pop));
            assertEquals(MachineException.Kind.STACK_MISMATCH, e.getKind());

            StepResult result = new Stepper(graph).step(new RuntimeContext(MachineKind.PUSHDOWN, "#b#"), pop);
            assertEquals(StepResult.Outcome.REJECT, result.outcome());
        }

        @Test
        @DisplayName("Accepting state needs an empty stack")
        void testEmptyStackAcceptance() throws Exception {
            TransitionGraph graph = build("""
                1] scan (#,2)
                2] accept
                """);
            Stepper stepper = new Stepper(graph);

            RuntimeContext empty = new RuntimeContext(MachineKind.PUSHDOWN, "##");
            assertEquals(StepResult.Outcome.ACCEPT, stepper.step(empty, graph.start()).outcome());

            RuntimeContext loaded = new RuntimeContext(MachineKind.PUSHDOWN, "##");
            loaded.stack1().push('a');
            assertEquals(StepResult.Outcome.REJECT, stepper.step(loaded, graph.start()).outcome());

            RuntimeContext twoStacks = new RuntimeContext(MachineKind.TWO_STACK_PUSHDOWN, "##");
            twoStacks.stack2().push('c');
            assertEquals(StepResult.Outcome.REJECT, stepper.step(twoStacks, graph.start()).outcome());
        }
    }

    @Nested
    @DisplayName("Transducer")
    class Transducer {

        @Test
        @DisplayName("Print emits and keeps the head")
        void testPrint() throws Exception {
            TransitionGraph graph = build("""
                1] scan (a,2)
                2] print (z,1)
                """);
            Stepper stepper = new Stepper(graph);
            RuntimeContext ctx = new RuntimeContext(MachineKind.TRANSDUCER, "#a#");

            StepResult scan = stepper.step(ctx, graph.start());
            assertEquals(2, ctx.getHead());

            StepResult print = stepper.step(ctx, scan.successor());
            assertEquals("z", ctx.outputContents());
            assertEquals(1, print.successorId());
            assertEquals(2, ctx.getHead());
        }

        @Test
        @DisplayName("Last boundary marker accepts without a transition")
        void testBoundaryShortcut() throws Exception {
            TransitionGraph graph = build("1] scan (a,1)");
            RuntimeContext ctx = new RuntimeContext(MachineKind.TRANSDUCER, "##");

            StepResult result = new Stepper(graph).step(ctx, graph.start());

            assertEquals(StepResult.Outcome.ACCEPT, result.outcome());
            assertNull(result.successor());
        }

        @Test
        @DisplayName("Print state without a print symbol")
        void testMissingPrintSymbol() {
            State print = new State(1, Direction.RIGHT, Action.PRINT, Symbols.NONE, Symbols.NONE, Symbols.NONE,
                    false, false, Map.of(Symbols.PLACEHOLDER, 1));
            TransitionGraph graph = TransitionGraph.of(List.of(print));

            MachineException e = assertThrows(MachineException.class,
                    () -> new Stepper(graph).step(new RuntimeContext(MachineKind.TRANSDUCER, "#a#"), print));
            assertEquals(MachineException.Kind.MALFORMED_PRINT_STATE, e.getKind());
        }

        @Test
        @DisplayName("Print state with two edges and no placeholder")
        void testAmbiguousPrint() {
            State print = new State(1, Direction.RIGHT, Action.PRINT, Symbols.NONE, Symbols.NONE, 'x',
                    false, false, Map.of('a', 1, 'b', 1));
            TransitionGraph graph = TransitionGraph.of(List.of(print));

            MachineException e = assertThrows(MachineException.class,
                    () -> new Stepper(graph).step(new RuntimeContext(MachineKind.TRANSDUCER, "#a#"), print));
            assertEquals(MachineException.Kind.MALFORMED_PRINT_STATE, e.getKind());
        }
    }
}
