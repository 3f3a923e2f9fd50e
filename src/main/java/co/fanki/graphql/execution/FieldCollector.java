package co.fanki.graphql.execution;

import co.fanki.graphql.language.Directive;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.language.Selection;
import co.fanki.graphql.language.SelectionSet;
import co.fanki.graphql.schema.DirectiveDefinition;
import co.fanki.graphql.schema.ObjectType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups the fields of selection sets by response key for a runtime
 * object type.
 *
 * <p>Fragments whose type condition does not apply are skipped, as are
 * selections excluded by {@code @skip} or {@code @include}. Keys keep
 * the order of their first occurrence.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FieldCollector {

    private final ValuesCoercer coercer;

    /**
     * Creates a new collector.
     *
     * @param theCoercer the coercer of directive arguments
     */
    public FieldCollector(final ValuesCoercer theCoercer) {
        this.coercer = theCoercer;
    }

    /**
     * Collects the fields of a selection set.
     *
     * @param context the request
     * @param type the runtime type of the object being completed
     * @param selectionSet the selection set
     * @return the fields by response key
     */
    public Map<String, List<Field>> collectFields(
            final ExecutionContext context, final ObjectType type,
            final SelectionSet selectionSet) {
        final Map<String, List<Field>> fields = new LinkedHashMap<>();
        collect(context, type, selectionSet, fields, new HashSet<>());
        return fields;
    }

    /**
     * Collects the sub-selections of fields merged under one response key.
     *
     * @param context the request
     * @param type the runtime type of the field value
     * @param mergedFields the field nodes sharing the response key
     * @return the sub-fields by response key
     */
    public Map<String, List<Field>> collectSubfields(
            final ExecutionContext context, final ObjectType type,
            final List<Field> mergedFields) {
        final Map<String, List<Field>> fields = new LinkedHashMap<>();
        final Set<String> visitedFragments = new HashSet<>();
        for (final Field field : mergedFields) {
            if (field.hasSelectionSet()) {
                collect(context, type, field.selectionSet(), fields,
                        visitedFragments);
            }
        }
        return fields;
    }

    private void collect(final ExecutionContext context,
            final ObjectType type, final SelectionSet selectionSet,
            final Map<String, List<Field>> fields,
            final Set<String> visitedFragments) {
        for (final Selection selection : selectionSet.selections()) {
            if (selection instanceof Field field) {
                if (shouldInclude(context, field.directives())) {
                    fields.computeIfAbsent(field.responseKey(),
                            key -> new ArrayList<>()).add(field);
                }
            } else if (selection instanceof InlineFragment inline) {
                if (shouldInclude(context, inline.directives())
                        && context.typeConditionMatches(
                                inline.typeCondition(), type)) {
                    collect(context, type, inline.selectionSet(), fields,
                            visitedFragments);
                }
            } else {
                final FragmentSpread spread = (FragmentSpread) selection;
                if (!shouldInclude(context, spread.directives())
                        || !visitedFragments.add(spread.name())) {
                    continue;
                }
                final FragmentDefinition fragment =
                        context.fragment(spread.name());
                if (fragment != null && context.typeConditionMatches(
                        fragment.typeCondition(), type)) {
                    collect(context, type, fragment.selectionSet(), fields,
                            visitedFragments);
                }
            }
        }
    }

    private boolean shouldInclude(final ExecutionContext context,
            final List<Directive> directives) {
        for (final Directive directive : directives) {
            if (DirectiveDefinition.SKIP.name().equals(directive.name())
                    && condition(context, DirectiveDefinition.SKIP,
                            directive)) {
                return false;
            }
            if (DirectiveDefinition.INCLUDE.name().equals(directive.name())
                    && !condition(context, DirectiveDefinition.INCLUDE,
                            directive)) {
                return false;
            }
        }
        return true;
    }

    private boolean condition(final ExecutionContext context,
            final DirectiveDefinition definition, final Directive directive) {
        final Object value = coercer.coerceArgumentValues(
                definition.arguments(), directive.arguments(),
                context.variables()).get("if");
        return Boolean.TRUE.equals(value);
    }
}
