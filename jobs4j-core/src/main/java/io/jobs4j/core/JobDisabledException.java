package io.jobs4j.core;

public class JobDisabledException extends JobsException {

    private final String jobName;

    public JobDisabledException(String jobName) {
        super("Job is disabled: " + jobName);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
