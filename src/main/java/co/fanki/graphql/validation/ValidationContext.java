package co.fanki.graphql.validation;

import co.fanki.graphql.language.Definition;
import co.fanki.graphql.language.Document;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.Selection;
import co.fanki.graphql.language.SelectionSet;
import co.fanki.graphql.language.Value;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.shared.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What the rules of one validation run share: the schema, the document,
 * the current {@link TypeInfo} and the collected errors.
 *
 * <p>Also answers the whole-document questions several rules ask, such
 * as which fragments an operation reaches and which variables it uses.
 * The answers are computed once per run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ValidationContext {

    private final Schema schema;
    private final Document document;
    private final Map<String, FragmentDefinition> fragments;
    private final Set<ValidationError> errors = new LinkedHashSet<>();
    private final Map<SelectionSet, List<FragmentSpread>> spreadsCache =
            new IdentityHashMap<>();
    private final Map<OperationDefinition, List<FragmentDefinition>>
            referencedCache = new IdentityHashMap<>();
    private final Map<OperationDefinition, List<VariableUsage>> usagesCache =
            new IdentityHashMap<>();
    private TypeInfo typeInfo;

    /**
     * Creates a new context.
     *
     * @param theSchema the schema
     * @param theDocument the document being validated
     */
    public ValidationContext(final Schema theSchema,
            final Document theDocument) {
        this.schema = theSchema;
        this.document = theDocument;
        this.fragments = theDocument.fragments();
    }

    public Schema schema() {
        return schema;
    }

    public Document document() {
        return document;
    }

    /** Returns the type information of the node being visited. */
    public TypeInfo typeInfo() {
        return typeInfo;
    }

    void typeInfo(final TypeInfo theTypeInfo) {
        typeInfo = theTypeInfo;
    }

    /**
     * Finds a fragment definition.
     *
     * @param name the fragment name
     * @return the first fragment with that name, or null
     */
    public FragmentDefinition fragment(final String name) {
        return fragments.get(name);
    }

    /**
     * Records an error. Identical errors are recorded once.
     *
     * @param rule the rule name
     * @param message the message
     * @param locations the offending nodes
     */
    public void report(final String rule, final String message,
            final List<SourceLocation> locations) {
        errors.add(new ValidationError(rule, message, locations));
    }

    /** Returns the recorded errors, in the order they were reported. */
    public List<ValidationError> errors() {
        return new ArrayList<>(errors);
    }

    // -- Whole document queries ----------------------------------------------

    /**
     * Returns the spreads directly inside a selection set, inline
     * fragments included but spreads not followed.
     *
     * @param selectionSet the selection set
     * @return the spreads, in document order
     */
    public List<FragmentSpread> fragmentSpreads(
            final SelectionSet selectionSet) {
        return spreadsCache.computeIfAbsent(selectionSet, key -> {
            final List<FragmentSpread> spreads = new ArrayList<>();
            final Deque<SelectionSet> pending = new ArrayDeque<>();
            pending.push(key);
            while (!pending.isEmpty()) {
                for (final Selection selection : pending.pop().selections()) {
                    if (selection instanceof FragmentSpread spread) {
                        spreads.add(spread);
                    } else if (selection instanceof InlineFragment inline) {
                        pending.push(inline.selectionSet());
                    } else {
                        final Field field = (Field) selection;
                        if (field.hasSelectionSet()) {
                            pending.push(field.selectionSet());
                        }
                    }
                }
            }
            return spreads;
        });
    }

    /**
     * Returns every fragment an operation reaches, directly or through
     * other fragments. Unknown fragment names are skipped.
     *
     * @param operation the operation
     * @return the fragments, each once
     */
    public List<FragmentDefinition> recursivelyReferencedFragments(
            final OperationDefinition operation) {
        return referencedCache.computeIfAbsent(operation, key -> {
            final List<FragmentDefinition> reached = new ArrayList<>();
            final Set<String> collected = new LinkedHashSet<>();
            final Deque<SelectionSet> pending = new ArrayDeque<>();
            pending.push(key.selectionSet());
            while (!pending.isEmpty()) {
                for (final FragmentSpread spread
                        : fragmentSpreads(pending.pop())) {
                    if (collected.add(spread.name())) {
                        final FragmentDefinition fragment =
                                fragment(spread.name());
                        if (fragment != null) {
                            reached.add(fragment);
                            pending.push(fragment.selectionSet());
                        }
                    }
                }
            }
            return reached;
        });
    }

    /**
     * Returns the variable usages of an operation, through every
     * fragment it reaches.
     *
     * @param operation the operation
     * @return the usages, with the types expected at each of them
     */
    public List<VariableUsage> recursiveVariableUsages(
            final OperationDefinition operation) {
        return usagesCache.computeIfAbsent(operation, key -> {
            final List<VariableUsage> usages = new ArrayList<>(
                    variableUsages(key));
            for (final FragmentDefinition fragment
                    : recursivelyReferencedFragments(key)) {
                usages.addAll(variableUsages(fragment));
            }
            return usages;
        });
    }

    private List<VariableUsage> variableUsages(final Definition definition) {
        final UsageCollector collector = new UsageCollector();
        final DocumentWalker walker = new DocumentWalker(schema, collector);
        collector.typeInfo = walker.typeInfo();
        walker.walk(definition);
        return collector.usages;
    }

    /** Collects the variable references of one definition. */
    private static final class UsageCollector implements DocumentVisitor {

        private final List<VariableUsage> usages = new ArrayList<>();
        private TypeInfo typeInfo;

        @Override
        public void enterVariable(final Value.Variable variable) {
            usages.add(new VariableUsage(variable, typeInfo.inputType(),
                    typeInfo.valueLocation()));
        }
    }
}
