package com.plotline.core.model;

import java.io.Serializable;

/**
 * A stretch of the manuscript, from scene {@code start} to scene {@code end}.
 */
public record PacingSpan(String start, String end, String reason) implements Serializable {}
