package com.planwatch.core.engine;

import com.planwatch.core.dispatch.DispatchException;
import com.planwatch.core.model.TerminationReason;
import com.planwatch.core.summary.SummaryArtifact;

import java.nio.file.Path;

/**
 * Outcome of a finished monitoring session.
 *
 * @param correlationId  the monitored workflow
 * @param reason         why the session ended
 * @param dispatchError  dispatch failure, null when the engine accepted the command
 * @param channelOpened  whether the event channel ever connected
 * @param summary        what was persisted, null if writing failed
 * @param artifact       where it was persisted, null if writing failed
 */
public record MonitorResult(
    String correlationId,
    TerminationReason reason,
    DispatchException dispatchError,
    boolean channelOpened,
    SummaryArtifact summary,
    Path artifact
) {

    /**
     * The one unrecoverable outcome: the command never reached the engine and nothing was heard.
     */
    public boolean dispatchFailedBeforeListening() {
        return dispatchError != null && !channelOpened;
    }
}
