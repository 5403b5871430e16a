package com.acme.finops.slots.wire;

public enum WireErrorCode {
    /** No bytes available where a varint was expected. */
    EMPTY_INPUT,
    /** The first byte announced more bytes than the input holds. */
    TRUNCATED_VARINT
}
