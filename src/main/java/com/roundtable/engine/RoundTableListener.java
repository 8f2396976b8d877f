package com.roundtable.engine;

import com.roundtable.models.ModelRef;

/**
 * Progress checkpoints of a round table. Used for status text only.
 * {@link #participantFinished} is called from worker threads.
 */
public interface RoundTableListener {

    RoundTableListener NONE = new RoundTableListener() {};

    default void roundStarted(int participantCount) {}

    default void participantFinished(String name, boolean succeeded) {}

    default void chairmanStarted(ModelRef chairman) {}
}
