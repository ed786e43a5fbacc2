package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

public record ChapterSummary(String summary, List<String> sceneIds) implements Serializable {

    public ChapterSummary {
        sceneIds = sceneIds != null ? List.copyOf(sceneIds) : List.of();
    }
}
