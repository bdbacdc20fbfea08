package io.pingjob.config;

import io.pingjob.Automator;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Ties the Automator to the container: started once every other bean is up, stopped first on
 * shutdown, and restartable through {@code context.stop()} / {@code context.start()}.
 */
public class PingJobLifecycle implements SmartLifecycle {
    private final Automator automator;

    public PingJobLifecycle(Automator automator) {
        this.automator = Objects.requireNonNull(automator, "automator must not be null");
    }

    @Override
    public void start() {
        automator.start();
    }

    @Override
    public void stop() {
        automator.stop();
    }

    @Override
    public boolean isRunning() {
        return automator.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
