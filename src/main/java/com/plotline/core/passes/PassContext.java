package com.plotline.core.passes;

import com.plotline.core.engine.CancellationToken;
import com.plotline.core.model.AnalysisDepth;

/**
 * Per-run state handed to every pass.
 *
 * @param token      cancellation flag polled between units of work
 * @param listener   progress sink for the pass
 * @param depth      requested depth, echoed into every AI request
 * @param modelUsage models that served the pass
 */
public record PassContext(
    CancellationToken token,
    PassProgressListener listener,
    AnalysisDepth depth,
    ModelUsage modelUsage
) {

    public PassContext {
        token = token != null ? token : new CancellationToken();
        listener = listener != null ? listener : PassProgressListener.NONE;
        depth = depth != null ? depth : AnalysisDepth.STANDARD;
        modelUsage = modelUsage != null ? modelUsage : new ModelUsage();
    }

    /** A context that is never cancelled and reports nowhere. */
    public static PassContext standalone() {
        return new PassContext(new CancellationToken(), PassProgressListener.NONE, AnalysisDepth.STANDARD, new ModelUsage());
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public void progress(int percent, String currentScene) {
        listener.onProgress(Math.max(0, Math.min(100, percent)), currentScene);
    }
}
