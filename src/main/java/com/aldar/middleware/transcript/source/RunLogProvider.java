package com.aldar.middleware.transcript.source;

import com.aldar.middleware.model.RunRecord;

import java.util.List;

/**
 * Read access to the orchestration service's run log.
 */
public interface RunLogProvider {

    /**
     * @throws RunLogUnavailableException when the upstream cannot be reached, times out or answers with an error
     */
    List<RunRecord> fetchRuns(String sessionId);
}
