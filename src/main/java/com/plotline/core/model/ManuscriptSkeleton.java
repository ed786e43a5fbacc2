package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Hierarchical digest of a manuscript: compressed scenes grouped into chapters, chapters
 * grouped into three acts, and an overview joining the acts.
 */
public record ManuscriptSkeleton(
    List<CompressedScene> scenes,
    List<ChapterSummary> chapters,
    List<ActSummary> acts,
    String overview
) implements Serializable {

    public ManuscriptSkeleton {
        scenes = scenes != null ? List.copyOf(scenes) : List.of();
        chapters = chapters != null ? List.copyOf(chapters) : List.of();
        acts = acts != null ? List.copyOf(acts) : List.of();
        overview = overview != null ? overview : "";
    }
}
