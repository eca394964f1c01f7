package io.github.manjago.automaton.debug;

import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.RuntimeContext;
import io.github.manjago.automaton.run.RunResult;
import io.github.manjago.automaton.run.StepEvent;
import io.github.manjago.automaton.run.StepListener;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records run steps for debugging and analysis.
 * <p>
 * Usage:
 * <pre>
 * TraceRecorder recorder = new TraceRecorder(1000); // keep 1000 steps
 * RunResult result = machine.run("#aabb#", recorder);
 * List&lt;TraceFrame&gt; frames = recorder.getFrames();
 * </pre>
 * Steps beyond the limit are counted but not kept. One recorder per run.
 */
public class TraceRecorder implements StepListener {

    private static final Logger log = LoggerFactory.getLogger(TraceRecorder.class);

    private final List<TraceFrame> frames = new ArrayList<>();
    private final int maxFrames;

    private String initialTape = "";
    private long dropped = 0;
    private @Nullable RunResult result;

    public TraceRecorder(int maxFrames) {
        if (maxFrames <= 0) {
            throw new IllegalArgumentException("maxFrames must be positive: " + maxFrames);
        }
        this.maxFrames = maxFrames;
    }

    @Override
    public void onStart(MachineKind kind, RuntimeContext context) {
        clear();
        initialTape = context.tapeContents();
    }

    @Override
    public void onStep(StepEvent event, RuntimeContext context) {
        if (frames.size() >= maxFrames) {
            if (dropped++ == 0) {
                log.debug("Trace limit {} reached, further steps are not recorded", maxFrames);
            }
            return;
        }
        frames.add(TraceFrame.capture(event, context));
    }

    @Override
    public void onHalt(RunResult result) {
        this.result = result;
    }

    /**
     * Check if recording is complete.
     */
    public boolean isComplete() {
        return frames.size() >= maxFrames;
    }

    /**
     * Get recorded frames.
     */
    public List<TraceFrame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    public int getFrameCount() {
        return frames.size();
    }

    /**
     * Steps that happened after the limit was reached.
     */
    public long getDroppedCount() {
        return dropped;
    }

    public String getInitialTape() {
        return initialTape;
    }

    /**
     * @return result of the run, or null if it has not halted (or failed)
     */
    public @Nullable RunResult getResult() {
        return result;
    }

    /**
     * Clear all recorded frames.
     */
    public void clear() {
        frames.clear();
        dropped = 0;
        result = null;
        initialTape = "";
    }
}
