package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * What the reader already knows when arriving at a scene.
 */
public record ReaderContext(
    List<String> knownCharacters,
    List<String> establishedSettings,
    List<String> revealedPlotPoints
) implements Serializable {

    public ReaderContext {
        knownCharacters = knownCharacters != null ? List.copyOf(knownCharacters) : List.of();
        establishedSettings = establishedSettings != null ? List.copyOf(establishedSettings) : List.of();
        revealedPlotPoints = revealedPlotPoints != null ? List.copyOf(revealedPlotPoints) : List.of();
    }

    public static ReaderContext empty() {
        return new ReaderContext(List.of(), List.of(), List.of());
    }
}
