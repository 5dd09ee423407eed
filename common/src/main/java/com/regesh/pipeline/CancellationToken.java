package com.regesh.pipeline;

/**
 * Cooperative cancellation flag threaded through batch and insert calls.
 *
 * <p>Work already in flight is not interrupted; work not yet started is skipped and
 * reported as failed, so result counts still match the input.</p>
 */
public class CancellationToken {

    /** Token that is never cancelled: the run always completes. */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
    };

    public static final String CANCELLED_MESSAGE = "cancelled";

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
