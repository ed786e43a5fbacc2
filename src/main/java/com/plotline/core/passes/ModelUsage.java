package com.plotline.core.passes;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the model names that served a pass. Written from worker threads.
 */
public class ModelUsage {

    private final Set<String> models = new LinkedHashSet<>();

    public synchronized void record(String model) {
        if (model != null && !model.isBlank()) {
            models.add(model);
        }
    }

    /** First model recorded, or null when the pass made no successful call. */
    public synchronized String first() {
        return models.isEmpty() ? null : models.iterator().next();
    }

    public synchronized List<String> all() {
        return List.copyOf(models);
    }
}
