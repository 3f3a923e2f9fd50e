package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Argument;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.language.Printer;
import co.fanki.graphql.language.Selection;
import co.fanki.graphql.language.SelectionSet;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.schema.ObjectType;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.shared.SourceLocation;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fields sharing a response key can be merged into a single response
 * entry.
 *
 * <p>When both parents may be the same object, the fields must name the
 * same field with the same arguments. In every case their return types
 * must have the same shape, and their sub-selections must be mergeable
 * in turn.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class OverlappingFieldsCanBeMerged extends ValidationRule {

    public OverlappingFieldsCanBeMerged(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterSelectionSet(final SelectionSet selectionSet) {
        final Map<String, List<FieldEntry>> byKey = new LinkedHashMap<>();
        collect(typeInfo().parentType(), selectionSet, byKey, new HashSet<>());

        for (final Map.Entry<String, List<FieldEntry>> entry
                : byKey.entrySet()) {
            final List<FieldEntry> fields = entry.getValue();
            for (int i = 0; i < fields.size(); i++) {
                for (int j = i + 1; j < fields.size(); j++) {
                    final Conflict conflict = findConflict(entry.getKey(),
                            false, fields.get(i), fields.get(j));
                    if (conflict != null) {
                        report("Fields \"" + conflict.responseKey()
                                + "\" conflict because " + conflict.reason()
                                + ". Use different aliases on the fields to"
                                + " fetch both if this was intentional.",
                                conflict.locations());
                    }
                }
            }
        }
    }

    // -- Collection ----------------------------------------------------------

    private void collect(final TypeDefinition parent,
            final SelectionSet selectionSet,
            final Map<String, List<FieldEntry>> byKey,
            final Set<String> visitedFragments) {
        final Schema schema = context().schema();
        for (final Selection selection : selectionSet.selections()) {
            if (selection instanceof Field field) {
                byKey.computeIfAbsent(field.responseKey(),
                        key -> new ArrayList<>())
                        .add(new FieldEntry(parent, field,
                                schema.fieldDefinition(parent, field.name())));
            } else if (selection instanceof InlineFragment inline) {
                final TypeDefinition type = inline.typeCondition() == null
                        ? parent
                        : schema.type(inline.typeCondition());
                collect(type, inline.selectionSet(), byKey, visitedFragments);
            } else {
                final FragmentSpread spread = (FragmentSpread) selection;
                final FragmentDefinition fragment =
                        context().fragment(spread.name());
                if (fragment != null && visitedFragments.add(spread.name())) {
                    collect(schema.type(fragment.typeCondition()),
                            fragment.selectionSet(), byKey, visitedFragments);
                }
            }
        }
    }

    // -- Comparison ----------------------------------------------------------

    private Conflict findConflict(final String responseKey,
            final boolean parentsExclusive, final FieldEntry a,
            final FieldEntry b) {
        if (a.field() == b.field()) {
            return null;
        }
        final boolean exclusive = parentsExclusive
                || a.parent() != b.parent()
                        && a.parent() instanceof ObjectType
                        && b.parent() instanceof ObjectType;

        final List<SourceLocation> locations = new ArrayList<>();
        locations.add(a.field().location());
        locations.add(b.field().location());

        if (!exclusive) {
            if (!a.field().name().equals(b.field().name())) {
                return new Conflict(responseKey, "\"" + a.field().name()
                        + "\" and \"" + b.field().name()
                        + "\" are different fields", locations);
            }
            if (!arguments(a.field()).equals(arguments(b.field()))) {
                return new Conflict(responseKey,
                        "they have differing arguments", locations);
            }
        }

        final TypeRef typeA = a.definition() == null
                ? null
                : a.definition().type();
        final TypeRef typeB = b.definition() == null
                ? null
                : b.definition().type();
        if (typeA != null && typeB != null && typesConflict(typeA, typeB)) {
            return new Conflict(responseKey, "they return conflicting types \""
                    + typeA + "\" and \"" + typeB + "\"", locations);
        }

        if (a.field().hasSelectionSet() && b.field().hasSelectionSet()) {
            final List<Conflict> nested = subfieldConflicts(exclusive,
                    a.field().selectionSet(), typeA,
                    b.field().selectionSet(), typeB);
            if (!nested.isEmpty()) {
                for (final Conflict conflict : nested) {
                    locations.addAll(conflict.locations());
                }
                return new Conflict(responseKey, nested.stream()
                        .map(conflict -> "subfields \""
                                + conflict.responseKey()
                                + "\" conflict because " + conflict.reason())
                        .collect(Collectors.joining(" and ")), locations);
            }
        }
        return null;
    }

    private List<Conflict> subfieldConflicts(final boolean exclusive,
            final SelectionSet setA, final TypeRef typeA,
            final SelectionSet setB, final TypeRef typeB) {
        final Schema schema = context().schema();
        final Map<String, List<FieldEntry>> fieldsA = new LinkedHashMap<>();
        final Map<String, List<FieldEntry>> fieldsB = new LinkedHashMap<>();
        collect(typeA == null ? null : schema.type(typeA), setA, fieldsA,
                new HashSet<>());
        collect(typeB == null ? null : schema.type(typeB), setB, fieldsB,
                new HashSet<>());

        final List<Conflict> conflicts = new ArrayList<>();
        for (final Map.Entry<String, List<FieldEntry>> entry
                : fieldsA.entrySet()) {
            final List<FieldEntry> others = fieldsB.get(entry.getKey());
            if (others == null) {
                continue;
            }
            for (final FieldEntry a : entry.getValue()) {
                for (final FieldEntry b : others) {
                    final Conflict conflict = findConflict(entry.getKey(),
                            exclusive, a, b);
                    if (conflict != null) {
                        conflicts.add(conflict);
                    }
                }
            }
        }
        return conflicts;
    }

    private boolean typesConflict(final TypeRef a, final TypeRef b) {
        if (a instanceof TypeRef.ListOf listA) {
            return !(b instanceof TypeRef.ListOf listB)
                    || typesConflict(listA.ofType(), listB.ofType());
        }
        if (b instanceof TypeRef.ListOf) {
            return true;
        }
        if (a instanceof TypeRef.NonNull nonNullA) {
            return !(b instanceof TypeRef.NonNull nonNullB)
                    || typesConflict(nonNullA.ofType(), nonNullB.ofType());
        }
        if (b instanceof TypeRef.NonNull) {
            return true;
        }
        final Schema schema = context().schema();
        if (schema.isLeafType(a) || schema.isLeafType(b)) {
            return !Objects.equals(a, b);
        }
        return false;
    }

    private static Map<String, String> arguments(final Field field) {
        final Map<String, String> printed = new LinkedHashMap<>();
        for (final Argument argument : field.arguments()) {
            printed.put(argument.name(), Printer.print(argument.value()));
        }
        return printed;
    }

    /** A field selected on a parent type, with its definition if known. */
    private record FieldEntry(TypeDefinition parent, Field field,
            FieldDefinition definition) {
    }

    /** Why two fields under one response key cannot be merged. */
    private record Conflict(String responseKey, String reason,
            List<SourceLocation> locations) {
    }
}
