package io.liparakis.chunkwire.wire;

import java.io.IOException;

/**
 * The single error type raised while reading or writing wire data.
 * <p>
 * The {@link Kind} tells callers what went wrong without a class per failure; the message
 * carries the details. Callers decide whether to close the connection or drop the packet.
 */
public class WireException extends IOException {

    /**
     * Failure categories.
     */
    public enum Kind {
        /** The source ended before a fixed-width field was complete. */
        SHORT_READ,
        /** A VarInt used more than five 7-bit groups. */
        VARINT_TOO_BIG,
        /** A VarLong used more than ten 7-bit groups. */
        VARLONG_TOO_BIG,
        /** A string payload was not valid UTF-8. */
        INVALID_UTF8,
        /** A length prefix was negative or above the accepted bound. */
        INVALID_LENGTH,
        /** A section had no block-state or biome container. */
        MISSING_SECTION_DATA,
        /** A registry name had no id and strict lookup was requested. */
        UNKNOWN_REGISTRY_ENTRY,
        /** A decoded value was structurally impossible (e.g. bits per entry out of range). */
        INVALID_ENTRY
    }

    private final Kind kind;

    public WireException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public WireException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    static WireException shortRead(String what, Throwable cause) {
        return new WireException(Kind.SHORT_READ, "Failed to read " + what, cause);
    }
}
