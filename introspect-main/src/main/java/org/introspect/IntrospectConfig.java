package org.introspect;

import java.util.Objects;
import java.util.Properties;

import javax.lang.model.SourceVersion;

import org.introspect.classify.OperatorTable;
import org.introspect.render.RenderBounds;

/**
 * Immutable rewrite settings.
 * <pre>
 * IntrospectConfig config = IntrospectConfig.builder()
 *         .renderBounds(new RenderBounds(512, 32))
 *         .rewriteIfThrow(false)
 *         .build();
 * </pre>
 */
public final class IntrospectConfig {

    public static final String PROPERTY_PREFIX = "introspect.";
    public static final String ROUTINE_PROPERTY = PROPERTY_PREFIX + "routine";
    public static final String MAX_TEMPLATE_LENGTH_PROPERTY = PROPERTY_PREFIX + "maxTemplateLength";
    public static final String MAX_ARGUMENTS_PROPERTY = PROPERTY_PREFIX + "maxArguments";
    public static final String SLOT_PREFIX_PROPERTY = PROPERTY_PREFIX + "slotPrefix";
    public static final String HONOR_ASSERTION_STATUS_PROPERTY = PROPERTY_PREFIX + "honorAssertionStatus";
    public static final String REWRITE_IF_THROW_PROPERTY = PROPERTY_PREFIX + "rewriteIfThrow";

    public static final String DEFAULT_SLOT_PREFIX = "$introspect";

    private final DiagnosticRoutine diagnosticRoutine;
    private final OperatorTable operatorTable;
    private final RenderBounds renderBounds;
    private final String slotPrefix;
    private final boolean honorAssertionStatus;
    private final boolean rewriteIfThrow;

    private IntrospectConfig(Builder builder) {
        this.diagnosticRoutine = builder.diagnosticRoutine;
        this.operatorTable = builder.operatorTable;
        this.renderBounds = builder.renderBounds;
        this.slotPrefix = builder.slotPrefix;
        this.honorAssertionStatus = builder.honorAssertionStatus;
        this.rewriteIfThrow = builder.rewriteIfThrow;
    }

    public static IntrospectConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults overlaid with the {@code introspect.*} system properties.
     */
    public static IntrospectConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Defaults overlaid with the {@code introspect.*} entries of the given properties.
     *
     * @throws IllegalArgumentException if a value is malformed; the message names the property
     */
    public static IntrospectConfig fromProperties(Properties properties) {
        Builder builder = builder();

        String routine = properties.getProperty(ROUTINE_PROPERTY);
        if (routine != null) {
            builder.diagnosticRoutine(DiagnosticRoutine.parse(routine.trim()));
        }

        String maxTemplateLength = properties.getProperty(MAX_TEMPLATE_LENGTH_PROPERTY);
        String maxArguments = properties.getProperty(MAX_ARGUMENTS_PROPERTY);
        if (maxTemplateLength != null || maxArguments != null) {
            builder.renderBounds(new RenderBounds(
                    intProperty(MAX_TEMPLATE_LENGTH_PROPERTY, maxTemplateLength, RenderBounds.DEFAULT_MAX_TEMPLATE_LENGTH),
                    intProperty(MAX_ARGUMENTS_PROPERTY, maxArguments, RenderBounds.DEFAULT_MAX_ARGUMENTS)));
        }

        String slotPrefix = properties.getProperty(SLOT_PREFIX_PROPERTY);
        if (slotPrefix != null) {
            builder.slotPrefix(slotPrefix.trim());
        }

        String honor = properties.getProperty(HONOR_ASSERTION_STATUS_PROPERTY);
        if (honor != null) {
            builder.honorAssertionStatus(booleanProperty(HONOR_ASSERTION_STATUS_PROPERTY, honor));
        }

        String rewriteIfThrow = properties.getProperty(REWRITE_IF_THROW_PROPERTY);
        if (rewriteIfThrow != null) {
            builder.rewriteIfThrow(booleanProperty(REWRITE_IF_THROW_PROPERTY, rewriteIfThrow));
        }

        return builder.build();
    }

    private static int intProperty(String name, String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + name + " is not an integer: " + value, e);
        }
    }

    private static boolean booleanProperty(String name, String value) {
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new IllegalArgumentException("Property " + name + " is not a boolean: " + value);
    }

    public DiagnosticRoutine getDiagnosticRoutine() {
        return diagnosticRoutine;
    }

    public OperatorTable getOperatorTable() {
        return operatorTable;
    }

    public RenderBounds getRenderBounds() {
        return renderBounds;
    }

    public String getSlotPrefix() {
        return slotPrefix;
    }

    public boolean isHonorAssertionStatus() {
        return honorAssertionStatus;
    }

    public boolean isRewriteIfThrow() {
        return rewriteIfThrow;
    }

    public Builder toBuilder() {
        return builder()
                .diagnosticRoutine(diagnosticRoutine)
                .operatorTable(operatorTable)
                .renderBounds(renderBounds)
                .slotPrefix(slotPrefix)
                .honorAssertionStatus(honorAssertionStatus)
                .rewriteIfThrow(rewriteIfThrow);
    }

    @Override
    public String toString() {
        return "IntrospectConfig{" +
               "diagnosticRoutine=" + diagnosticRoutine +
               ", operatorTable=" + operatorTable +
               ", renderBounds=" + renderBounds +
               ", slotPrefix='" + slotPrefix + '\'' +
               ", honorAssertionStatus=" + honorAssertionStatus +
               ", rewriteIfThrow=" + rewriteIfThrow +
               '}';
    }

    public static final class Builder {

        private DiagnosticRoutine diagnosticRoutine = DiagnosticRoutine.DEFAULT;
        private OperatorTable operatorTable = OperatorTable.defaults();
        private RenderBounds renderBounds = RenderBounds.defaults();
        private String slotPrefix = DEFAULT_SLOT_PREFIX;
        private boolean honorAssertionStatus = true;
        private boolean rewriteIfThrow = true;

        private Builder() {}

        public Builder diagnosticRoutine(DiagnosticRoutine diagnosticRoutine) {
            this.diagnosticRoutine = Objects.requireNonNull(diagnosticRoutine, "diagnosticRoutine");
            return this;
        }

        public Builder operatorTable(OperatorTable operatorTable) {
            this.operatorTable = Objects.requireNonNull(operatorTable, "operatorTable");
            return this;
        }

        public Builder renderBounds(RenderBounds renderBounds) {
            this.renderBounds = Objects.requireNonNull(renderBounds, "renderBounds");
            return this;
        }

        public Builder slotPrefix(String slotPrefix) {
            // slot names are <prefix><occurrence>_<index>, so the prefix must start an identifier
            if (slotPrefix == null || !SourceVersion.isIdentifier(slotPrefix) || SourceVersion.isKeyword(slotPrefix)) {
                throw new IllegalArgumentException("Slot prefix is not a Java identifier: " + slotPrefix);
            }
            this.slotPrefix = slotPrefix;
            return this;
        }

        public Builder honorAssertionStatus(boolean honorAssertionStatus) {
            this.honorAssertionStatus = honorAssertionStatus;
            return this;
        }

        public Builder rewriteIfThrow(boolean rewriteIfThrow) {
            this.rewriteIfThrow = rewriteIfThrow;
            return this;
        }

        public IntrospectConfig build() {
            return new IntrospectConfig(this);
        }
    }
}
