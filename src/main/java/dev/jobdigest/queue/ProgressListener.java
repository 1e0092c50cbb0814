package dev.jobdigest.queue;

/**
 * Receives progress checkpoints from a running handler.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (percent, status) -> { };

    void onProgress(int percent, String status);
}
