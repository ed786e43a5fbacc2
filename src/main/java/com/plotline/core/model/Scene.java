package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A unit of narrative as loaded from the manuscript.
 *
 * @param id               stable scene identifier
 * @param text             full scene text
 * @param wordCount        word count reported by the loader (zero or negative when unknown)
 * @param position         current position in the manuscript
 * @param originalPosition position before any reordering
 * @param characters       character names mentioned in the scene
 * @param timeMarkers      relative or absolute time cues ("next morning")
 * @param locationMarkers  location names mentioned in the scene
 * @param hasBeenMoved     true when the scene was moved by a reordering
 */
public record Scene(
    String id,
    String text,
    int wordCount,
    int position,
    int originalPosition,
    List<String> characters,
    List<String> timeMarkers,
    List<String> locationMarkers,
    boolean hasBeenMoved
) implements Serializable {

    public Scene {
        text = text != null ? text : "";
        characters = characters != null ? List.copyOf(characters) : List.of();
        timeMarkers = timeMarkers != null ? List.copyOf(timeMarkers) : List.of();
        locationMarkers = locationMarkers != null ? List.copyOf(locationMarkers) : List.of();
    }

    /** Convenience constructor for scenes without markers. */
    public Scene(String id, String text, int position) {
        this(id, text, -1, position, position, List.of(), List.of(), List.of(), false);
    }
}
