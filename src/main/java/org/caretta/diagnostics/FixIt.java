package org.caretta.diagnostics;

import org.caretta.source.SourceLocation;
import org.caretta.source.SourceRange;

import java.util.Comparator;
import java.util.Objects;

/**
 * A suggested edit: replace {@code range} with {@code text}. An empty range is a
 * pure insertion, an empty text a pure removal.
 *
 * @param range The source range to replace.
 * @param text The replacement text.
 */
public record FixIt(SourceRange range, String text) implements Comparable<FixIt> {

    private static final Comparator<FixIt> ORDER = Comparator
            .comparing((FixIt f) -> f.range().start())
            .thenComparing(f -> f.range().end())
            .thenComparing(FixIt::text);

    public FixIt {
        Objects.requireNonNull(range, "range cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
    }

    public static FixIt insertion(SourceLocation location, String text) {
        return new FixIt(SourceRange.at(location), text);
    }

    public static FixIt replacement(SourceRange range, String text) {
        return new FixIt(range, text);
    }

    public static FixIt removal(SourceRange range) {
        return new FixIt(range, "");
    }

    /**
     * A fix-it can be drawn on the single annotation line below the source only if its
     * text has no line breaks or tabs and uses one byte per column.
     *
     * @return {@code true} if the fix-it can be rendered.
     */
    public boolean isRenderable() {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r' || c == '\t' || c > 0x7F) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(FixIt other) {
        return ORDER.compare(this, other);
    }
}
