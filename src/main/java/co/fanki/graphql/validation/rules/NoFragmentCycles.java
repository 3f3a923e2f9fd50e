package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.shared.SourceLocation;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fragments do not spread themselves, directly or through others.
 *
 * <p>Depth first search over the spread graph; a spread of a fragment
 * that is on the current path closes a cycle, reported once with the
 * spreads forming it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NoFragmentCycles extends ValidationRule {

    /** Fragments whose spreads were already searched. */
    private final Set<String> visited = new HashSet<>();

    /** The spreads from the starting fragment to the current one. */
    private final List<FragmentSpread> spreadPath = new ArrayList<>();

    /** Position in {@link #spreadPath} of each fragment on the path. */
    private final Map<String, Integer> pathIndex = new HashMap<>();

    public NoFragmentCycles(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterFragmentDefinition(final FragmentDefinition fragment) {
        detectCycles(fragment);
    }

    private void detectCycles(final FragmentDefinition fragment) {
        if (!visited.add(fragment.name())) {
            return;
        }

        final List<FragmentSpread> spreads =
                context().fragmentSpreads(fragment.selectionSet());
        if (spreads.isEmpty()) {
            return;
        }

        pathIndex.put(fragment.name(), spreadPath.size());

        for (final FragmentSpread spread : spreads) {
            final Integer cycleIndex = pathIndex.get(spread.name());
            spreadPath.add(spread);
            if (cycleIndex == null) {
                final FragmentDefinition next =
                        context().fragment(spread.name());
                if (next != null) {
                    detectCycles(next);
                }
            } else {
                reportCycle(spread.name(),
                        spreadPath.subList(cycleIndex, spreadPath.size()));
            }
            spreadPath.remove(spreadPath.size() - 1);
        }

        pathIndex.remove(fragment.name());
    }

    private void reportCycle(final String fragmentName,
            final List<FragmentSpread> cycle) {
        final List<FragmentSpread> via = cycle.subList(0, cycle.size() - 1);
        final String suffix = via.isEmpty()
                ? ""
                : " via " + via.stream()
                        .map(spread -> "\"" + spread.name() + "\"")
                        .collect(Collectors.joining(", "));
        final List<SourceLocation> locations = cycle.stream()
                .map(FragmentSpread::location)
                .toList();
        report("Cannot spread fragment \"" + fragmentName
                + "\" within itself" + suffix + ".", locations);
    }
}
