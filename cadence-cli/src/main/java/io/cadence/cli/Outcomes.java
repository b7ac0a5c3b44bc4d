package io.cadence.cli;

import io.cadence.core.engine.JobState;
import io.cadence.core.engine.RunOutcome;

final class Outcomes {

    private Outcomes() {
    }

    static String describe(RunOutcome outcome, CliContext context) {
        String prefix = outcome.job().id() + " (" + outcome.job().name() + "): ";
        if (!outcome.success()) {
            return prefix + "failed, " + outcome.status().error();
        }
        if (outcome.state() == JobState.RETIRED) {
            return prefix + "completed, retired";
        }
        if (outcome.state() == JobState.COMPLETED) {
            return prefix + "completed";
        }
        return prefix + "completed, next run " + context.format(outcome.job().nextRun());
    }
}
