package com.aijudge.debate;

import com.aijudge.model.DebateTranscript;

/**
 * Receives a snapshot after every closed round, after judging and on failure.
 */
@FunctionalInterface
public interface DebateProgressListener {

    DebateProgressListener NONE = snapshot -> {
    };

    void onProgress(DebateTranscript snapshot);
}
