package co.fanki.graphql.language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed request: operations and fragments, in document order.
 *
 * @param definitions the definitions
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Document(List<Definition> definitions) {

    /** Copies the definitions. */
    public Document {
        definitions = List.copyOf(definitions);
    }

    /**
     * Parses a document.
     *
     * @param source the query text
     * @return the document
     * @throws SyntaxException on malformed text
     */
    public static Document parse(final String source) {
        return Parser.parse(source);
    }

    /** Returns the operations, in document order. */
    public List<OperationDefinition> operations() {
        final List<OperationDefinition> result = new ArrayList<>();
        for (final Definition definition : definitions) {
            if (definition instanceof OperationDefinition operation) {
                result.add(operation);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the fragments keyed by name.
     *
     * <p>When a name is defined twice the first definition wins; the
     * validator reports the duplicate.</p>
     *
     * @return the fragments, in document order
     */
    public Map<String, FragmentDefinition> fragments() {
        final Map<String, FragmentDefinition> result = new LinkedHashMap<>();
        for (final Definition definition : definitions) {
            if (definition instanceof FragmentDefinition fragment) {
                result.putIfAbsent(fragment.name(), fragment);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Finds an operation by name.
     *
     * @param name the operation name
     * @return the operation, or null if there is none with that name
     */
    public OperationDefinition operation(final String name) {
        for (final OperationDefinition operation : operations()) {
            if (name.equals(operation.name())) {
                return operation;
            }
        }
        return null;
    }
}
