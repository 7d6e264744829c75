package net.cronhook.core.error;

public class JobNotFoundException extends RuntimeException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("CRON job with id " + jobId + " not found");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
