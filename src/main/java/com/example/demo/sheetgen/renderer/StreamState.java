package com.example.demo.sheetgen.renderer;

/**
 * Lifecycle of a {@link StreamingReportWriter}.
 */
public enum StreamState {
    /** Created, nothing rendered yet. */
    IDLE,
    /** Rendering static sections on the way to the next streaming target. */
    ADVANCING,
    /** Positioned on a target section whose title and header are not written yet. */
    AWAITING_FIRST_WRITE,
    /** Appending data batches to the target section. */
    WRITING,
    CLOSED
}
