package com.plotline.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Lightweight metadata extracted from a scene during compression.
 *
 * @param tensionLevel keyword-derived tension, always within [1, 10]
 */
public record SceneMetadata(
    int wordCount,
    Set<String> characters,
    Set<String> locations,
    EmotionalTone emotionalTone,
    int tensionLevel
) implements Serializable {

    public SceneMetadata {
        characters = characters != null ? Collections.unmodifiableSet(new LinkedHashSet<>(characters)) : Set.of();
        locations = locations != null ? Collections.unmodifiableSet(new LinkedHashSet<>(locations)) : Set.of();
        emotionalTone = emotionalTone != null ? emotionalTone : EmotionalTone.NEUTRAL;
        tensionLevel = Math.max(1, Math.min(10, tensionLevel));
    }
}
