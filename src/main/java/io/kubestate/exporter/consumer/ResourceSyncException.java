package io.kubestate.exporter.consumer;

import lombok.Getter;

/**
 * Transient failure of the list/watch protocol. Always recovered by listing again.
 */
@Getter
public class ResourceSyncException extends RuntimeException {

    public enum Reason {
        /** The listing call failed. */
        LIST_FAILED,
        /** The watch could not be opened or broke with an error. */
        WATCH_FAILED,
        /** The requested version is no longer available on the server. */
        EXPIRED,
        /** The server ended the stream without an error. */
        STREAM_CLOSED
    }

    private final Reason reason;

    public ResourceSyncException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ResourceSyncException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * @return true when listing again right away is the expected recovery, without backoff
     */
    public boolean isRelistImmediately() {
        return reason == Reason.EXPIRED || reason == Reason.STREAM_CLOSED;
    }
}
