package com.example.clihelp.help;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * One row of help text made of two blocks: the signature (name of an argument,
 * option or command) padded to a fixed column, and its description.
 * <p>
 * If either block overflowed, formatting the line also writes continuation
 * rows below it until all overflow text has been written.
 */
public class Line {

    private final HelpLayout layout;
    private final ContentBlock signature;
    private final ContentBlock description;

    public Line(HelpLayout layout) {
        this.layout = Objects.requireNonNull(layout, "Layout must not be null");
        this.signature = new ContentBlock(layout.getSignatureWidth(), true);
        this.description = new ContentBlock(layout.getDescriptionWidth(), false);
    }

    public ContentBlock signature() {
        return signature;
    }

    public ContentBlock description() {
        return description;
    }

    /**
     * Writes this row and every continuation row it produces.
     */
    public void format(OutputStream out) throws IOException {
        Line current = this;
        while (current != null) {
            current.formatRow(out);
            current = current.continuation();
        }
    }

    private void formatRow(OutputStream out) throws IOException {
        signature.format(out);
        description.format(out);
        out.write('\n');
    }

    /**
     * Builds the row carrying this line's overflow text, or returns null when
     * nothing overflowed. The continuation signature gets the standard indent
     * again so it stays aligned with the rows above.
     */
    public Line continuation() {
        byte[] signatureOverflow = signature.overflow();
        byte[] descriptionOverflow = description.overflow();
        if (signatureOverflow == null && descriptionOverflow == null) {
            return null;
        }

        Line next = new Line(layout);
        next.signature.appendPadding(layout.getIndent());
        if (signatureOverflow != null) {
            next.signature.append(signatureOverflow);
        }
        if (descriptionOverflow != null) {
            next.description.append(descriptionOverflow);
        }
        return next;
    }
}
