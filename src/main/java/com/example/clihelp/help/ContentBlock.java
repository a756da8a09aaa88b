package com.example.clihelp.help;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A fixed-width cell of a help row.
 * <p>
 * Text goes into the visible part until it holds {@code width} bytes; anything
 * past that lands in a single overflow part of the same width, which the owning
 * {@link Line} carries over to a continuation row. Text that does not fit into
 * both is rejected with {@link BlockOverflowException}.
 */
public class ContentBlock {

    private static final byte WHITE_SPACE = ' ';

    private final int width;
    private final boolean fill;

    private final byte[] visible;
    private int visibleLength;
    private final byte[] overflow;
    private int overflowLength;

    /**
     * @param width capacity of the visible part (and of the overflow part) in bytes
     * @param fill  whether {@link #format} pads the visible part to full width
     */
    public ContentBlock(int width, boolean fill) {
        if (width <= 0) {
            throw new IllegalArgumentException("Block width must be positive: " + width);
        }
        this.width = width;
        this.fill = fill;
        this.visible = new byte[width];
        this.overflow = new byte[width];
    }

    public int getWidth() { return width; }
    public boolean isFill() { return fill; }

    public int remaining() {
        return width - visibleLength;
    }

    /**
     * Appends {@code n} spaces, or as many as still fit. Never overflows.
     */
    public void appendPadding(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Padding must not be negative: " + n);
        }
        int count = Math.min(n, remaining());
        Arrays.fill(visible, visibleLength, visibleLength + count, WHITE_SPACE);
        visibleLength += count;
    }

    public void append(String text) {
        append(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Appends bytes to the visible part; the part that does not fit goes to the
     * overflow part. The block is left untouched when the bytes do not fit into
     * both.
     *
     * @throws BlockOverflowException if the overflow part cannot take the excess
     */
    public void append(byte[] bytes) {
        int remaining = remaining();
        if (bytes.length <= remaining) {
            System.arraycopy(bytes, 0, visible, visibleLength, bytes.length);
            visibleLength += bytes.length;
            return;
        }

        int excess = bytes.length - remaining;
        if (overflowLength + excess > width) {
            throw new BlockOverflowException(width, overflowLength + excess - width);
        }
        System.arraycopy(bytes, 0, visible, visibleLength, remaining);
        visibleLength = width;
        System.arraycopy(bytes, remaining, overflow, overflowLength, excess);
        overflowLength += excess;
    }

    /**
     * Writes the visible part, padded with spaces up to the width when this is
     * a filling block.
     */
    public void format(OutputStream out) throws IOException {
        out.write(visible, 0, visibleLength);
        if (fill) {
            for (int i = visibleLength; i < width; i++) {
                out.write(WHITE_SPACE);
            }
        }
    }

    /**
     * Returns the bytes that did not fit, or null when everything fit.
     */
    public byte[] overflow() {
        if (overflowLength == 0) return null;
        return Arrays.copyOf(overflow, overflowLength);
    }

    public int visibleLength() {
        return visibleLength;
    }

    public int overflowLength() {
        return overflowLength;
    }

    /** The visible part without fill padding. */
    public String visibleContent() {
        return new String(visible, 0, visibleLength, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "ContentBlock{" +
            "width=" + width +
            ", fill=" + fill +
            ", visible='" + visibleContent() + '\'' +
            ", overflow=" + overflowLength +
            '}';
    }
}
