package com.tickwork.scheduler.run;

/**
 * Normal result of a handler invocation.
 */
public record JobOutcome(boolean skipped, String reason) {

    private static final JobOutcome SUCCESS = new JobOutcome(false, null);

    public static JobOutcome success() {
        return SUCCESS;
    }

    /**
     * The handler decided there was nothing to do.
     */
    public static JobOutcome skipped(String reason) {
        return new JobOutcome(true, reason);
    }
}
