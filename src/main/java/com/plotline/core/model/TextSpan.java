package com.plotline.core.model;

import java.io.Serializable;

/**
 * Character offsets into scene text, end exclusive.
 */
public record TextSpan(int start, int end) implements Serializable {}
