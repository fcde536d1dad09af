package com.eis.cdc.io;

/**
 * Malformed circuit description code.
 *
 * <p>
 * Carries the reason, the character position where parsing stopped and, when
 * available, the offending part of the input.
 */
public class CdcParseException extends IllegalArgumentException {
    private final String reason;
    private final int position;
    private final String offending;

    public CdcParseException(String reason, int position, String offending) {
        super(format(reason, position, offending));
        this.reason = reason;
        this.position = position;
        this.offending = offending;
    }

    public String getReason() {
        return reason;
    }

    /** Zero-based character index into the parsed text. */
    public int getPosition() {
        return position;
    }

    /** The offending substring, or null. */
    public String getOffending() {
        return offending;
    }

    private static String format(String reason, int position, String offending) {
        StringBuilder sb = new StringBuilder(reason).append(" at position ").append(position);
        if (offending != null && !offending.isEmpty())
            sb.append(": '").append(offending).append('\'');
        return sb.toString();
    }
}
