package com.plotline.core.model;

import java.io.Serializable;

/**
 * Structural hints attached to a transition.
 */
public record TransitionFlags(
    boolean needsSceneBreak,
    boolean needsTransitionScene,
    boolean chapterBoundaryCandidate
) implements Serializable {

    public static TransitionFlags none() {
        return new TransitionFlags(false, false, false);
    }
}
