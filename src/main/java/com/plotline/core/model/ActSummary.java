package com.plotline.core.model;

import java.io.Serializable;

/**
 * @param chapterStart index of the first chapter in the act
 * @param chapterEnd   index of the last chapter in the act, inclusive; equal to start when the act is empty
 */
public record ActSummary(String name, String summary, int chapterStart, int chapterEnd) implements Serializable {}
