package com.plotline.core.passes;

/**
 * Receives progress within a single pass.
 */
@FunctionalInterface
public interface PassProgressListener {

    PassProgressListener NONE = (percent, currentScene) -> {};

    /**
     * @param percent      progress within the pass, 0 to 100
     * @param currentScene id of the scene most recently reached, may be null
     */
    void onProgress(int percent, String currentScene);
}
