package co.fanki.graphql.validation;

import co.fanki.graphql.language.Document;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.Selection;
import co.fanki.graphql.language.SelectionSet;
import co.fanki.graphql.schema.CacheControl;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.schema.ObjectType;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.shared.Preconditions;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Computes the cache policy of a response from the cache hints of the
 * fields an operation selects and of the object types they return.
 *
 * <p>The document is expected to be valid; unknown fields and fragments
 * are ignored.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CacheControlCalculator {

    private final Schema schema;
    private final Map<String, FragmentDefinition> fragments;

    /**
     * Creates a new calculator.
     *
     * @param theSchema the schema, cannot be null
     * @param theDocument the validated document, cannot be null
     */
    public CacheControlCalculator(final Schema theSchema,
            final Document theDocument) {
        this.schema = Preconditions.requireNonNull(theSchema,
                "Schema is required");
        this.fragments = Preconditions.requireNonNull(theDocument,
                "Document is required").fragments();
    }

    /**
     * Merges the hints reachable from an operation.
     *
     * @param operation the operation to run, cannot be null
     * @return the merged policy, {@link CacheControl#DEFAULT} when no
     *         hint is reachable
     */
    public CacheControl calculate(final OperationDefinition operation) {
        Preconditions.requireNonNull(operation, "Operation is required");
        final ObjectType root = schema.rootType(operation.operation());
        if (root == null) {
            return CacheControl.DEFAULT;
        }
        return visit(root, operation.selectionSet(), CacheControl.DEFAULT
                .merge(root.cacheControl()), new HashSet<>());
    }

    private CacheControl visit(final TypeDefinition parent,
            final SelectionSet selectionSet, final CacheControl current,
            final Set<String> visitedFragments) {
        CacheControl merged = current;
        for (final Selection selection : selectionSet.selections()) {
            if (selection instanceof Field field) {
                final FieldDefinition definition =
                        schema.fieldDefinition(parent, field.name());
                if (definition == null) {
                    continue;
                }
                merged = merged.merge(definition.cacheControl());
                final TypeDefinition type = schema.type(definition.type());
                if (type instanceof ObjectType object) {
                    merged = merged.merge(object.cacheControl());
                }
                if (field.hasSelectionSet()) {
                    merged = visit(type, field.selectionSet(), merged,
                            visitedFragments);
                }
            } else if (selection instanceof InlineFragment inline) {
                final TypeDefinition type = inline.typeCondition() == null
                        ? parent
                        : schema.type(inline.typeCondition());
                merged = visit(type, inline.selectionSet(), merged,
                        visitedFragments);
            } else {
                final FragmentSpread spread = (FragmentSpread) selection;
                final FragmentDefinition fragment =
                        fragments.get(spread.name());
                if (fragment != null && visitedFragments.add(spread.name())) {
                    merged = visit(schema.type(fragment.typeCondition()),
                            fragment.selectionSet(), merged, visitedFragments);
                }
            }
        }
        return merged;
    }
}
