package io.jobs4j.config;

import io.jobs4j.Jobs;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges jobs start/stop lifecycle with the Spring container lifecycle.
 */
public class JobsLifecycle implements SmartLifecycle {
    private final Jobs jobs;
    private final boolean autoStartup;

    public JobsLifecycle(Jobs jobs, boolean autoStartup) {
        this.jobs = jobs;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        jobs.start();
    }

    @Override
    public void stop() {
        jobs.stop();
    }

    @Override
    public boolean isRunning() {
        return jobs.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
