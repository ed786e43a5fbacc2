package com.plotline.core.model;

import java.io.Serializable;

/**
 * Health of a chapter along four dimensions. Every flag reads {@code true} when the
 * dimension is healthy.
 */
public record ChapterHealth(
    boolean unity,
    boolean completeness,
    boolean balancedPacing,
    boolean narrativePurpose
) implements Serializable {}
