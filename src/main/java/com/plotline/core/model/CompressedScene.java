package com.plotline.core.model;

import java.io.Serializable;

/**
 * Token-bounded representation of a scene, regenerated on every analysis run.
 *
 * @param opening  first N words of the scene (whole text when shorter)
 * @param closing  last N words of the scene (whole text when shorter)
 * @param summary  AI summary or word-truncated text
 */
public record CompressedScene(
    String id,
    int position,
    String opening,
    String closing,
    String summary,
    SceneMetadata metadata
) implements Serializable {}
