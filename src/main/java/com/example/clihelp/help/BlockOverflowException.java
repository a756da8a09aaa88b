package com.example.clihelp.help;

/**
 * Thrown when text appended to a {@link ContentBlock} does not fit into the
 * block plus its single overflow row.
 */
public class BlockOverflowException extends IllegalStateException {

    private final int width;
    private final int rejectedBytes;

    public BlockOverflowException(int width, int rejectedBytes) {
        super("Content exceeds block width " + width + " and its overflow row by " + rejectedBytes + " bytes");
        this.width = width;
        this.rejectedBytes = rejectedBytes;
    }

    public int getWidth() { return width; }

    /** Bytes beyond what the visible and overflow rows could hold. */
    public int getRejectedBytes() { return rejectedBytes; }
}
