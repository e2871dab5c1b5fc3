package org.janelia.astrometry.wcs;

import java.io.Serializable;

/**
 * A single FITS header keyword (name, raw value and optional comment).
 * String values are stored with their enclosing single quotes, exactly as they appear in a header card.
 */
public class FitsKeyword
        implements Serializable {

    public static final int CARD_LENGTH = 80;

    private final String name;
    private final String value;
    private final String comment;

    public FitsKeyword(final String name,
                       final String value,
                       final String comment) {
        this.name = name.trim().toUpperCase();
        this.value = value == null ? "" : value.trim();
        this.comment = comment == null ? "" : comment.trim();
    }

    public static FitsKeyword forString(final String name,
                                        final String value,
                                        final String comment) {
        return new FitsKeyword(name, "'" + value.replace("'", "''") + "'", comment);
    }

    /**
     * Numeric values are written with {@link Double#toString} which reproduces the exact same
     * double when parsed back.
     */
    public static FitsKeyword forNumber(final String name,
                                        final double value,
                                        final String comment) {
        return new FitsKeyword(name, Double.toString(value).replace('e', 'E'), comment);
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public String getComment() {
        return comment;
    }

    public boolean isString() {
        return value.startsWith("'");
    }

    /**
     * @return the unquoted string value of this keyword.
     */
    public String getStringValue() {
        if (isString()) {
            final int end = value.lastIndexOf('\'');
            return value.substring(1, end > 0 ? end : value.length()).replace("''", "'").trim();
        }
        return value;
    }

    /**
     * @return the numeric value of this keyword.
     *
     * @throws IllegalArgumentException
     *   if the value is not numeric.
     */
    public double getNumericValue()
            throws IllegalArgumentException {
        try {
            return Double.parseDouble(value.replace('D', 'E'));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("keyword " + name + " value '" + value + "' is not numeric", e);
        }
    }

    /**
     * @return this keyword formatted as an 80 character header card.
     */
    public String toCard() {
        final StringBuilder card = new StringBuilder(CARD_LENGTH);
        card.append(String.format("%-8s= ", name));
        if (isString()) {
            card.append(String.format("%-20s", value));
        } else {
            card.append(String.format("%20s", value));
        }
        if (comment.length() > 0) {
            card.append(" / ").append(comment);
        }
        final String text = card.toString();
        return text.length() > CARD_LENGTH ? text.substring(0, CARD_LENGTH) : String.format("%-80s", text);
    }

    /**
     * Parses a header card produced by {@link #toCard()} or any other standard FITS writer.
     *
     * @return the parsed keyword, or null for cards without a value indicator (comments, END, ...).
     */
    public static FitsKeyword parseCard(final String card) {
        if ((card.length() < 10) || (card.charAt(8) != '=')) {
            return null;
        }
        final String name = card.substring(0, 8).trim();
        final String rest = card.substring(9).trim();

        final String value;
        String comment = null;
        if (rest.startsWith("'")) {
            int end = 1;
            while (end < rest.length()) {
                if (rest.charAt(end) == '\'') {
                    if ((end + 1 < rest.length()) && (rest.charAt(end + 1) == '\'')) {
                        end += 2;
                        continue;
                    }
                    break;
                }
                end++;
            }
            value = rest.substring(0, Math.min(end + 1, rest.length()));
            final int slash = rest.indexOf('/', value.length());
            if (slash >= 0) {
                comment = rest.substring(slash + 1);
            }
        } else {
            final int slash = rest.indexOf('/');
            if (slash >= 0) {
                value = rest.substring(0, slash);
                comment = rest.substring(slash + 1);
            } else {
                value = rest;
            }
        }
        return new FitsKeyword(name, value, comment);
    }

    @Override
    public String toString() {
        return toCard().trim();
    }
}
