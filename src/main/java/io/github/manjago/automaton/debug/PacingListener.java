package io.github.manjago.automaton.debug;

import io.github.manjago.automaton.core.RuntimeContext;
import io.github.manjago.automaton.run.StepEvent;
import io.github.manjago.automaton.run.StepListener;

import java.time.Duration;

/**
 * Slows a run down by sleeping after every step, for watching a live trace.
 * <p>
 * An interrupt ends the pausing: the interrupt flag is restored and the
 * rest of the run goes at full speed.
 */
public class PacingListener implements StepListener {

    private final long delayMillis;
    private boolean interrupted = false;

    public PacingListener(Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay must not be negative: " + delay);
        }
        this.delayMillis = delay.toMillis();
    }

    @Override
    public void onStep(StepEvent event, RuntimeContext context) {
        if (delayMillis == 0 || interrupted || event.isHalting()) {
            return;
        }
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
            interrupted = true;
            Thread.currentThread().interrupt();
        }
    }

    public long getDelayMillis() {
        return delayMillis;
    }

    /**
     * @return true once an interrupt has ended the pausing
     */
    public boolean isInterrupted() {
        return interrupted;
    }
}
