package com.ciflow.core;

import com.ciflow.expr.EvaluationContext;
import com.ciflow.expr.Template;

/**
 * A concurrency group: a key template rendered against the run context, and whether a new run
 * entering the group cancels the run already in it.
 *
 * <p>With {@code cancelInProgress} at most one run per key is active: the newcomer cancels the
 * incumbent. Without it the newcomer waits until the incumbent finishes.</p>
 */
public final class ConcurrencyGroup {
    private final Template key;
    private final boolean cancelInProgress;

    public ConcurrencyGroup(Template key, boolean cancelInProgress) {
        this.key = key;
        this.cancelInProgress = cancelInProgress;
    }

    public String resolveKey(RunContext context) {
        return key.render(EvaluationContext.of(context));
    }

    public Template getKey() {
        return key;
    }

    public boolean isCancelInProgress() {
        return cancelInProgress;
    }
}
