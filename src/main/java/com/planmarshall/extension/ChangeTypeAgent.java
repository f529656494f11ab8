package com.planmarshall.extension;

import com.planmarshall.core.model.ChangeType;

/**
 * Chooses the executor that performs the work for a kind of change.
 */
@FunctionalInterface
public interface ChangeTypeAgent extends Extension {

    /**
     * @return executor reference matching a {@code TaskExecutor} id, or {@code null} to select by profile
     */
    String executorFor(ChangeType changeType);
}
