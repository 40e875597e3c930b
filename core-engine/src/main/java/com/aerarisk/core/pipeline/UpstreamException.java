package com.aerarisk.core.pipeline;

/**
 * A call to the population store, snapshot store or audit sink failed.
 *
 * <p>
 * Covers transport errors, authentication and schema rejections, and
 * unreadable responses. Never retried; the run is aborted.
 * </p>
 *
 * @since 1.0.0
 */
public class UpstreamException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
