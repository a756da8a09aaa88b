package com.example.clihelp.help;

import java.util.Objects;

/**
 * Column geometry of a help text.
 */
public final class HelpLayout {

    public static final int DEFAULT_SIGNATURE_WIDTH = 50;
    public static final int DEFAULT_DESCRIPTION_WIDTH = 500;
    public static final int DEFAULT_INDENT = 4;
    public static final int DEFAULT_VALUES_INDENT = 2;

    public static final HelpLayout DEFAULT = new HelpLayout(
            DEFAULT_SIGNATURE_WIDTH, DEFAULT_DESCRIPTION_WIDTH, DEFAULT_INDENT, DEFAULT_VALUES_INDENT);

    private final int signatureWidth;
    private final int descriptionWidth;
    private final int indent;
    private final int valuesIndent;

    /**
     * @param signatureWidth   width of the left column, always padded to full width
     * @param descriptionWidth width of the right column, never padded
     * @param indent           spaces before every signature (and again before long-only option names)
     * @param valuesIndent     spaces before a {@code values:} row that follows a description
     */
    public HelpLayout(int signatureWidth, int descriptionWidth, int indent, int valuesIndent) {
        if (signatureWidth <= 0) {
            throw new IllegalArgumentException("Signature width must be positive: " + signatureWidth);
        }
        if (descriptionWidth <= 0) {
            throw new IllegalArgumentException("Description width must be positive: " + descriptionWidth);
        }
        if (indent < 0 || indent >= signatureWidth) {
            throw new IllegalArgumentException("Indent must be in [0, " + signatureWidth + "): " + indent);
        }
        if (valuesIndent < 0 || valuesIndent >= descriptionWidth) {
            throw new IllegalArgumentException("Values indent must be in [0, " + descriptionWidth + "): " + valuesIndent);
        }
        this.signatureWidth = signatureWidth;
        this.descriptionWidth = descriptionWidth;
        this.indent = indent;
        this.valuesIndent = valuesIndent;
    }

    public int getSignatureWidth() { return signatureWidth; }
    public int getDescriptionWidth() { return descriptionWidth; }
    public int getIndent() { return indent; }
    public int getValuesIndent() { return valuesIndent; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HelpLayout that = (HelpLayout) o;
        return signatureWidth == that.signatureWidth
                && descriptionWidth == that.descriptionWidth
                && indent == that.indent
                && valuesIndent == that.valuesIndent;
    }

    @Override
    public int hashCode() {
        return Objects.hash(signatureWidth, descriptionWidth, indent, valuesIndent);
    }

    @Override
    public String toString() {
        return "HelpLayout{" +
            "signatureWidth=" + signatureWidth +
            ", descriptionWidth=" + descriptionWidth +
            ", indent=" + indent +
            ", valuesIndent=" + valuesIndent +
            '}';
    }
}
