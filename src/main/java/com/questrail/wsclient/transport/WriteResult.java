package com.questrail.wsclient.transport;

/**
 * Result of one synchronous write.
 *
 * @param cause why the write failed; {@code null} on success
 */
public record WriteResult(Throwable cause) {

    private static final WriteResult WRITTEN = new WriteResult(null);

    public static WriteResult written() {
        return WRITTEN;
    }

    public static WriteResult failed(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause must not be null for a failed write");
        }
        return new WriteResult(cause);
    }

    public boolean isSuccess() {
        return cause == null;
    }
}
