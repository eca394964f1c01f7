package io.github.manjago.automaton.debug;

import io.github.manjago.automaton.config.MachineConfig;
import io.github.manjago.automaton.core.Action;
import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.StepResult;
import io.github.manjago.automaton.run.Machine;
import io.github.manjago.automaton.run.RunResult;
import io.github.manjago.automaton.run.StepEvent;
import io.github.manjago.automaton.run.StepListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TraceRecorder, TracePrinter and PacingListener.
 */
class TraceRecorderTest {

    private Machine machine;

    @BeforeEach
    void setUp() throws Exception {
        machine = Machine.fromSource(MachineKind.PUSHDOWN, """
            1] scan (a,2)
            2] push (a,2) (b,3)
            3] pop (b,3) (#,4)
            4] accept
            """, MachineConfig.builder().build());
    }

    @Test
    @DisplayName("Records one frame per step")
    void testRecord() throws Exception {
        TraceRecorder recorder = new TraceRecorder(100);

        RunResult result = machine.run("#aabb#", recorder);

        assertEquals(result.steps(), recorder.getFrameCount());
        assertEquals("#aabb#", recorder.getInitialTape());
        assertSame(result, recorder.getResult());
        assertFalse(recorder.isComplete());

        TraceFrame second = recorder.getFrames().get(1);
        assertEquals(2, second.event().stateId());
        assertEquals('a', second.event().read());
        assertEquals("a", second.stack1());
        assertEquals(3, second.head());
    }

    @Test
    @DisplayName("Stops recording at the limit")
    void testLimit() throws Exception {
        TraceRecorder recorder = new TraceRecorder(2);

        RunResult result = machine.run("#aabb#", recorder);

        assertEquals(2, recorder.getFrameCount());
        assertTrue(recorder.isComplete());
        assertEquals(result.steps() - 2, recorder.getDroppedCount());
    }

    @Test
    @DisplayName("Recorder resets on a new run")
    void testReuse() throws Exception {
        TraceRecorder recorder = new TraceRecorder(100);

        machine.run("#aabb#", recorder);
        machine.run("#ab#", recorder);

        assertEquals(3, recorder.getFrameCount());
        assertEquals("#ab#", recorder.getInitialTape());
    }

    @Test
    @DisplayName("Printer shows the highlighted tape and the result")
    void testPrinter() throws Exception {
        StringWriter buffer = new StringWriter();
        TracePrinter printer = new TracePrinter(new PrintWriter(buffer));

        machine.run("#ab#", printer);

        String text = buffer.toString();
        assertTrue(text.contains("Pushdown automaton, start: #[a]b#"), text);
        assertTrue(text.contains("#a[b]#"), text);
        assertTrue(text.contains("ACCEPT after 3 steps (state 4)"), text);
    }

    @Test
    @DisplayName("Printer limit truncates the live trace")
    void testPrinterLimit() throws Exception {
        StringWriter buffer = new StringWriter();
        TracePrinter printer = new TracePrinter(new PrintWriter(buffer)).limit(1);

        machine.run("#aabb#", printer);

        String text = buffer.toString();
        assertTrue(text.contains("trace limit of 1 steps reached"), text);
        assertTrue(text.contains("ACCEPT"), text);
    }

    @Test
    @DisplayName("Summary table has a row per frame")
    void testSummary() throws Exception {
        TraceRecorder recorder = new TraceRecorder(100);
        machine.run("#ab#", recorder);
        StringWriter buffer = new StringWriter();

        new TracePrinter(new PrintWriter(buffer)).printSummary(recorder.getFrames());

        assertEquals(2 + 3, buffer.toString().lines().count());
    }

    @Test
    @DisplayName("Pacing with zero delay does not change the run")
    void testPacing() throws Exception {
        PacingListener pacing = new PacingListener(Duration.ZERO);
        TraceRecorder recorder = new TraceRecorder(100);

        RunResult result = machine.run("#ab#", StepListener.composite(pacing, recorder));

        assertTrue(result.accepted());
        assertEquals(3, recorder.getFrameCount());
        assertThrows(IllegalArgumentException.class, () -> new PacingListener(Duration.ofMillis(-1)));
    }

    @Test
    @DisplayName("Pacing sleeps after every non-halting step")
    void testPacingDelay() throws Exception {
        PacingListener pacing = new PacingListener(Duration.ofMillis(20));

        long start = System.nanoTime();
        RunResult result = machine.run("#ab#", pacing);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(result.accepted());
        assertTrue(elapsedMillis >= 40, "elapsed " + elapsedMillis + " ms");
        assertFalse(pacing.isInterrupted());
    }

    @Test
    @DisplayName("Interrupt ends pausing and keeps the interrupt flag")
    void testPacingInterrupt() {
        PacingListener pacing = new PacingListener(Duration.ofSeconds(30));
        StepEvent event = new StepEvent(1, 1, Action.SCAN, 'a', 2, 2, StepResult.Outcome.CONTINUE);

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            Thread.currentThread().interrupt();
            pacing.onStep(event, null);
            assertTrue(Thread.interrupted());

            pacing.onStep(event, null);
        });
        assertTrue(pacing.isInterrupted());
    }
}
