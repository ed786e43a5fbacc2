package com.plotline.core.model;

import java.io.Serializable;

/**
 * Shape of the tension curve inside a chapter.
 */
public record PacingProfile(
    boolean frontLoaded,
    boolean saggyMiddle,
    boolean rushedEnding
) implements Serializable {}
