package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An ordered collection of scenes under analysis.
 */
public record Manuscript(
    String id,
    String title,
    List<Scene> scenes,
    List<String> originalOrder,
    List<String> currentOrder
) implements Serializable {

    public Manuscript {
        scenes = scenes != null ? List.copyOf(scenes) : List.of();
        originalOrder = originalOrder != null ? List.copyOf(originalOrder) : scenes.stream().map(Scene::id).toList();
        currentOrder = currentOrder != null ? List.copyOf(currentOrder) : scenes.stream().map(Scene::id).toList();
    }

    public Manuscript(String id, String title, List<Scene> scenes) {
        this(id, title, scenes, null, null);
    }
}
