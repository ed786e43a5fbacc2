package com.plotline.core.model;

import java.io.Serializable;

/**
 * A pass-level failure recorded in the progress snapshot.
 */
public record PassError(String pass, String message) implements Serializable {}
