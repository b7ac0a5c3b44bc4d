package io.cadence.core.dispatch;

/**
 * Outcome of a dispatch. {@code code} is the process exit code, or {@link #LAUNCH_FAILED} /
 * {@link #TIMED_OUT} when no exit code was observed; {@code error} describes the failure, if any.
 */
public record ExitStatus(int code, String error) {
    public static final int LAUNCH_FAILED = -1;
    public static final int TIMED_OUT = -2;

    public static ExitStatus of(int code) {
        return new ExitStatus(code, code == 0 ? null : "exited with code " + code);
    }

    public static ExitStatus launchFailed(String reason) {
        return new ExitStatus(LAUNCH_FAILED, "failed to launch: " + reason);
    }

    public static ExitStatus timedOut(long seconds) {
        return new ExitStatus(TIMED_OUT, "timed out after " + seconds + "s");
    }

    public boolean success() {
        return code == 0;
    }
}
