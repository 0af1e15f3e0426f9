package org.introspect.classify;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.introspect.tree.OperatorKind;

/**
 * Maps the operator kinds that failure messages decompose to their display glyphs.
 * Operators absent from the table are rendered as opaque values.
 */
public final class OperatorTable {

    private static final OperatorTable DEFAULTS = builder()
            .with(OperatorKind.EQUALS, "==")
            .with(OperatorKind.NOT_EQUALS, "!=")
            .with(OperatorKind.LESS, "<")
            .with(OperatorKind.GREATER, ">")
            .with(OperatorKind.LESS_EQUALS, "<=")
            .with(OperatorKind.GREATER_EQUALS, ">=")
            .with(OperatorKind.AND, "&&")
            .with(OperatorKind.OR, "||")
            .with(OperatorKind.PLUS, "+")
            .with(OperatorKind.MINUS, "-")
            .with(OperatorKind.MULTIPLY, "*")
            .with(OperatorKind.DIVIDE, "/")
            .with(OperatorKind.REMAINDER, "%")
            .build();

    private final Map<OperatorKind, String> glyphs;

    private OperatorTable(Map<OperatorKind, String> glyphs) {
        this.glyphs = Collections.unmodifiableMap(new EnumMap<>(glyphs));
    }

    public static OperatorTable defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> glyph(OperatorKind kind) {
        return Optional.ofNullable(glyphs.get(kind));
    }

    public boolean contains(OperatorKind kind) {
        return glyphs.containsKey(kind);
    }

    public Map<OperatorKind, String> asMap() {
        return glyphs;
    }

    /**
     * Starts a builder pre-populated with this table's entries.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.glyphs.putAll(glyphs);
        return builder;
    }

    @Override
    public String toString() {
        return "OperatorTable" + glyphs;
    }

    public static final class Builder {

        private final Map<OperatorKind, String> glyphs = new EnumMap<>(OperatorKind.class);

        private Builder() {}

        public Builder with(OperatorKind kind, String glyph) {
            glyphs.put(kind, validate(kind, glyph));
            return this;
        }

        public Builder without(OperatorKind kind) {
            glyphs.remove(kind);
            return this;
        }

        public OperatorTable build() {
            return new OperatorTable(glyphs);
        }

        // glyphs end up inside generated string literals and formatter templates
        private static String validate(OperatorKind kind, String glyph) {
            if (glyph == null || glyph.isBlank()) {
                throw new IllegalArgumentException("Blank glyph for operator " + kind);
            }
            for (int i = 0; i < glyph.length(); i++) {
                char c = glyph.charAt(i);
                if (c == '{' || c == '}' || c == '"' || c == '\\' || Character.isISOControl(c)) {
                    throw new IllegalArgumentException("Glyph '" + glyph + "' for operator " + kind
                                                       + " contains an unsupported character");
                }
            }
            return glyph;
        }
    }
}
