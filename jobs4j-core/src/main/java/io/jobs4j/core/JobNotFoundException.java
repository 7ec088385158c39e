package io.jobs4j.core;

public class JobNotFoundException extends JobsException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("No job registered for name: " + jobName);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
