package com.threatflow.assembler.parse;

/**
 * Raised when buffered-but-unterminated model output would exceed the configured bound.
 * Fatal for the session: without a record boundary in sight the stream cannot recover.
 */
public class StreamBufferOverflowException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final int maxBufferChars;
    private final long attemptedChars;

    public StreamBufferOverflowException(int maxBufferChars, long attemptedChars) {
        super("Stream buffer exceeded maximum size: " + maxBufferChars
                + " (attempted " + attemptedChars + " chars)");
        this.maxBufferChars = maxBufferChars;
        this.attemptedChars = attemptedChars;
    }

    public int getMaxBufferChars() {
        return maxBufferChars;
    }

    public long getAttemptedChars() {
        return attemptedChars;
    }
}
