package co.fanki.graphql.validation;

import co.fanki.graphql.shared.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 * Base class of the validation rules.
 *
 * <p>A rule is created per validation run and receives the callbacks
 * of a single walk over the document. Rules do not depend on each other
 * and never modify the document.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class ValidationRule implements DocumentVisitor {

    private final ValidationContext context;

    /**
     * Creates a new rule.
     *
     * @param theContext the validation context
     */
    protected ValidationRule(final ValidationContext theContext) {
        this.context = theContext;
    }

    /** Returns the rule name reported with its errors. */
    public String name() {
        return getClass().getSimpleName();
    }

    protected ValidationContext context() {
        return context;
    }

    protected TypeInfo typeInfo() {
        return context.typeInfo();
    }

    /**
     * Reports a violation of this rule.
     *
     * @param message the message
     * @param locations the offending nodes, nulls are ignored
     */
    protected void report(final String message,
            final SourceLocation... locations) {
        context.report(name(), message, Arrays.stream(locations)
                .filter(location -> location != null)
                .toList());
    }

    /**
     * Reports a violation of this rule.
     *
     * @param message the message
     * @param locations the offending nodes
     */
    protected void report(final String message,
            final List<SourceLocation> locations) {
        context.report(name(), message, locations);
    }
}
