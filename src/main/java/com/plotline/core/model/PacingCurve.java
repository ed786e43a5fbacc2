package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;

public record PacingCurve(
    List<PacingSpan> slowSpots,
    List<PacingSpan> rushedSections
) implements Serializable {

    public PacingCurve {
        slowSpots = slowSpots != null ? List.copyOf(slowSpots) : List.of();
        rushedSections = rushedSections != null ? List.copyOf(rushedSections) : List.of();
    }

    public static PacingCurve empty() {
        return new PacingCurve(List.of(), List.of());
    }
}
