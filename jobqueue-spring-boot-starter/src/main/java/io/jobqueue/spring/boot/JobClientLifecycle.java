package io.jobqueue.spring.boot;

import io.jobqueue.JobClient;
import io.jobqueue.JobClientState;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the {@link JobClient} once the application context is refreshed and stops it,
 * draining in-flight jobs, before singletons are destroyed.
 */
public class JobClientLifecycle implements SmartLifecycle {
    private final JobClient jobClient;

    public JobClientLifecycle(JobClient jobClient) {
        this.jobClient = Objects.requireNonNull(jobClient, "jobClient");
    }

    @Override
    public void start() {
        jobClient.start();
    }

    @Override
    public void stop() {
        jobClient.stop();
    }

    @Override
    public boolean isRunning() {
        return jobClient.state() == JobClientState.RUNNING;
    }
}
