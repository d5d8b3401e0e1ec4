package com.threatflow.assembler.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.threatflow.assembler.model.ParsedRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns an arbitrary sequence of text fragments into newline-delimited JSON records.
 *
 * <p>Fragment boundaries are not assumed to line up with record boundaries: every complete
 * line is decoded as soon as its newline arrives and the unterminated tail stays buffered
 * for the next call. The concatenation of all consumed lines and the current buffer is
 * always the prefix of the stream fed so far.
 *
 * <p>Provider framing (SSE {@code data:} prefixes and the like) must already be stripped.
 * Not thread-safe; one instance per session.
 */
public class IncrementalStreamParser {
    public static final int DEFAULT_MAX_BUFFER_CHARS = 1024 * 1024;

    private static final Logger LOG = LoggerFactory.getLogger(IncrementalStreamParser.class);

    private final int maxBufferChars;
    private final StringBuilder buffer = new StringBuilder();
    // Everything before this offset is known to hold no newline.
    private int scanOffset;
    private long linesConsumed;
    private long recordsDecoded;

    public IncrementalStreamParser() {
        this(DEFAULT_MAX_BUFFER_CHARS);
    }

    public IncrementalStreamParser(int maxBufferChars) {
        if (maxBufferChars <= 0) {
            throw new IllegalArgumentException("maxBufferChars must be positive: " + maxBufferChars);
        }
        this.maxBufferChars = maxBufferChars;
    }

    /**
     * Appends {@code fragment} and returns every record completed by it.
     *
     * @throws StreamBufferOverflowException if the buffer would grow past the configured maximum
     */
    public ParseResult feed(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return new ParseResult(Collections.emptyList(), buffer.length());
        }
        long attempted = (long) buffer.length() + fragment.length();
        if (attempted > maxBufferChars) {
            LOG.warn("Stream buffer overflow (buffered={}, fragment={}, max={})",
                    buffer.length(), fragment.length(), maxBufferChars);
            throw new StreamBufferOverflowException(maxBufferChars, attempted);
        }

        buffer.append(fragment);
        List<ParsedRecord> records = new ArrayList<>();
        int lineStart = 0;
        int newline = buffer.indexOf("\n", scanOffset);
        while (newline >= 0) {
            decodeInto(buffer.substring(lineStart, newline), records);
            lineStart = newline + 1;
            newline = buffer.indexOf("\n", lineStart);
        }
        if (lineStart > 0) {
            buffer.delete(0, lineStart);
        }
        scanOffset = buffer.length();
        return new ParseResult(records, buffer.length());
    }

    /**
     * Decodes whatever is left in the buffer as a final, unterminated line and clears it.
     * Call once the upstream signals end of stream.
     */
    public ParseResult finish() {
        List<ParsedRecord> records = new ArrayList<>(1);
        if (buffer.length() > 0) {
            decodeInto(buffer.toString(), records);
        }
        reset();
        return new ParseResult(records, 0);
    }

    public void reset() {
        buffer.setLength(0);
        scanOffset = 0;
    }

    public int bufferSize() {
        return buffer.length();
    }

    public long linesConsumed() {
        return linesConsumed;
    }

    public long recordsDecoded() {
        return recordsDecoded;
    }

    private void decodeInto(String line, List<ParsedRecord> out) {
        linesConsumed++;
        ParsedRecord record = RecordDecoder.decode(line);
        if (record != null) {
            recordsDecoded++;
            out.add(record);
        }
    }
}
