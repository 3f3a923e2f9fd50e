package co.fanki.graphql.execution;

import co.fanki.graphql.TestSchema;
import co.fanki.graphql.language.Document;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.Parser;
import co.fanki.graphql.schema.ObjectType;
import co.fanki.graphql.schema.Schema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link FieldCollector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FieldCollectorTest {

    private final Schema schema = new TestSchema().schema();

    private final FieldCollector collector = new FieldCollector(
            new ValuesCoercer(schema));

    @Test
    void whenCollecting_givenRepeatedKeys_shouldMergeInFirstSeenOrder() {
        final ExecutionContext context = context("""
                { hello user(id: 1) { id } ...Root hello }
                fragment Root on Query { user(id: 1) { name } price }
                """, Map.of());

        final Map<String, List<Field>> fields = collect(context,
                schema.queryType());

        assertEquals(List.of("hello", "user", "price"),
                List.copyOf(fields.keySet()));
        assertEquals(2, fields.get("hello").size());
        assertEquals(2, fields.get("user").size());
    }

    @Test
    void whenCollecting_givenSkipAndInclude_shouldHonourBoth() {
        final ExecutionContext context = context("""
                query ($on: Boolean!) {
                  hello @skip(if: $on)
                  price @include(if: $on)
                  fail @skip(if: false) @include(if: false)
                  ... @include(if: $on) { users { id } }
                }
                """, Map.of("on", true));

        assertEquals(List.of("price", "users"),
                List.copyOf(collect(context, schema.queryType()).keySet()));
    }

    @Test
    void whenCollecting_givenTypeConditions_shouldKeepMatchingFragments() {
        final ExecutionContext context = context("""
                { node(id: 1) { ... on User { name } ... on Post { title }
                  ... on Node { id } } }
                """, Map.of());
        final Field node = (Field) context.operation().selectionSet()
                .selections().get(0);

        final Map<String, List<Field>> fields = collector.collectSubfields(
                context, (ObjectType) schema.type("User"), List.of(node));

        assertEquals(List.of("name", "id"), List.copyOf(fields.keySet()));
    }

    private Map<String, List<Field>> collect(final ExecutionContext context,
            final ObjectType type) {
        return collector.collectFields(context, type,
                context.operation().selectionSet());
    }

    private ExecutionContext context(final String query,
            final Map<String, Object> variables) {
        final Document document = Parser.parse(query);
        final OperationDefinition operation = document.operations().get(0);
        return ExecutionContext.newContext()
                .schema(schema)
                .document(document)
                .operation(operation)
                .variables(new ValuesCoercer(schema).coerceVariableValues(
                        operation, variables))
                .executor(Runnable::run)
                .build();
    }
}
