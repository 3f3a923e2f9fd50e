package co.fanki.graphql.validation;

import co.fanki.graphql.TestSchema;
import co.fanki.graphql.language.Parser;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.shared.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link Validator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ValidatorTest {

    private final Schema schema = new TestSchema().schema();

    @Test
    void whenValidating_givenValidDocument_shouldReturnNoErrors() {
        final List<ValidationError> errors = validate("""
                query Find($id: Int!, $show: Boolean = true) {
                  user(id: $id) {
                    id
                    ...Parts @include(if: $show)
                    friends { ... on User { role } }
                  }
                  search { __typename ... on Post { title } }
                  echo(input: {title: "t"}, times: 2)
                }
                fragment Parts on User { name tags }
                """);

        assertTrue(errors.isEmpty(), errors.toString());
    }

    @Test
    void whenValidating_givenUnknownField_shouldReportIt() {
        final List<ValidationError> errors = validate(
                "{ user(id: 1) { nope } }");

        assertEquals(1, errors.size());
        final ValidationError error = errors.get(0);
        assertEquals("FieldsOnCorrectType", error.rule());
        assertEquals("Cannot query field \"nope\" on type \"User\".",
                error.message());
        assertEquals(List.of(new SourceLocation(1, 17)), error.locations());
    }

    @Test
    void whenValidating_givenObjectWithoutSelection_shouldReportIt() {
        assertEquals(List.of("Field \"user\" of type \"User\" must have a"
                + " selection of subfields. Did you mean \"user { ... }\"?"),
                messages("{ user(id: 1) }"));
    }

    @Test
    void whenValidating_givenLeafWithSelection_shouldReportIt() {
        assertTrue(messages("{ hello { x } }").contains("Field \"hello\""
                + " must not have a selection since type \"String!\" has no"
                + " subfields."));
    }

    @Test
    void whenValidating_givenMissingRequiredArgument_shouldReportIt() {
        assertEquals(List.of("Field \"user\" argument \"id\" of type"
                + " \"Int!\" is required, but it was not provided."),
                messages("{ user { id } }"));
    }

    @Test
    void whenValidating_givenDirectiveWithoutArgument_shouldReportIt() {
        assertEquals(List.of("Directive \"@skip\" argument \"if\" of type"
                + " \"Boolean!\" is required, but it was not provided."),
                messages("{ hello @skip }"));
    }

    @Test
    void whenValidating_givenUnknownArgument_shouldReportIt() {
        assertEquals(List.of("Unknown argument \"foo\" on field"
                + " \"Query.user\"."),
                messages("{ user(id: 1, foo: 2) { id } }"));
    }

    @Test
    void whenValidating_givenDuplicateArgument_shouldReportIt() {
        assertTrue(messages("{ user(id: 1, id: 2) { id } }").contains(
                "There can be only one argument named \"id\"."));
    }

    @Test
    void whenValidating_givenUnknownDirective_shouldReportIt() {
        assertEquals(List.of("Unknown directive \"@nope\"."),
                messages("{ hello @nope }"));
    }

    @Test
    void whenValidating_givenMisplacedDirective_shouldReportIt() {
        assertEquals(List.of("Directive \"@deprecated\" may not be used on"
                + " FIELD."), messages("{ hello @deprecated }"));
    }

    @Test
    void whenValidating_givenRepeatedDirective_shouldReportIt() {
        assertEquals(List.of("The directive \"@skip\" can only be used once"
                + " at this location."),
                messages("{ hello @skip(if: false) @skip(if: true) }"));
    }

    @Test
    void whenValidating_givenWrongScalarLiteral_shouldReportIt() {
        assertEquals(List.of("Expected value of type \"Int\", found \"1\";"
                + " Int cannot represent non-integer value: \"1\""),
                messages("{ user(id: \"1\") { id } }"));
    }

    @Test
    void whenValidating_givenNullForNonNullArgument_shouldReportIt() {
        assertEquals(List.of("Expected value of type \"Int!\", found null."),
                messages("{ user(id: null) { id } }"));
    }

    @Test
    void whenValidating_givenIncompleteInputObject_shouldReportFields() {
        assertEquals(List.of("Field \"PostInput.title\" of required type"
                + " \"String!\" was not provided."),
                messages("{ echo(input: {draft: true}) }"));
        assertEquals(List.of("Field \"extra\" is not defined by type"
                + " \"PostInput\"."),
                messages("{ echo(input: {title: \"t\", extra: 1}) }"));
    }

    @Test
    void whenValidating_givenUndefinedVariable_shouldReportIt() {
        assertEquals(List.of("Variable \"$id\" is not defined."),
                messages("query { user(id: $id) { id } }"));
        assertEquals(List.of("Variable \"$id\" is not defined by operation"
                + " \"Q\"."),
                messages("query Q { user(id: $id) { id } }"));
    }

    @Test
    void whenValidating_givenUnusedVariable_shouldReportIt() {
        assertEquals(List.of("Variable \"$x\" is never used in operation"
                + " \"Q\"."), messages("query Q($x: Int) { hello }"));
    }

    @Test
    void whenValidating_givenVariableUsedThroughFragment_shouldAcceptIt() {
        assertTrue(messages("""
                query Q($id: Int!) { ...Root }
                fragment Root on Query { user(id: $id) { id } }
                """).isEmpty());
    }

    @Test
    void whenValidating_givenNullableVariableInNonNullPosition_shouldReport() {
        assertEquals(List.of("Variable \"$id\" of type \"Int\" used in"
                + " position expecting type \"Int!\"."),
                messages("query Q($id: Int) { user(id: $id) { id } }"));
    }

    @Test
    void whenValidating_givenNullableVariableWithDefault_shouldAcceptIt() {
        assertTrue(messages("query Q($id: Int = 1) { user(id: $id) { id } }")
                .isEmpty());
    }

    @Test
    void whenValidating_givenNonInputVariable_shouldReportIt() {
        assertTrue(messages("query Q($u: User) { hello }").contains(
                "Variable \"$u\" cannot be non-input type \"User\"."));
    }

    @Test
    void whenValidating_givenDuplicateVariable_shouldReportIt() {
        assertTrue(messages("query Q($a: Int, $a: Int) { user(id: 1) { id }"
                + " echo(times: $a) }").contains(
                        "There can be only one variable named \"$a\"."));
    }

    @Test
    void whenValidating_givenOperationProblems_shouldReportThem() {
        assertEquals(List.of("This anonymous operation must be the only"
                + " defined operation."),
                messages("{ hello } query Q { hello }"));
        assertEquals(List.of("There can be only one operation named \"Q\"."),
                messages("query Q { hello } query Q { hello }"));
    }

    @Test
    void whenValidating_givenFragmentProblems_shouldReportThem() {
        assertEquals(List.of("Unknown fragment \"Missing\"."),
                messages("{ user(id: 1) { ...Missing } }"));
        assertEquals(List.of("Fragment \"Unused\" is never used."),
                messages("{ hello } fragment Unused on User { id }"));
        assertEquals(List.of("Unknown type \"Ghost\"."),
                messages("{ node(id: 1) { ... on Ghost { id } } }"));
        assertEquals(List.of("Fragment cannot condition on non composite"
                + " type \"Int\"."),
                messages("{ node(id: 1) { ... on Int { id } } }"));
    }

    @Test
    void whenValidating_givenImpossibleSpread_shouldReportIt() {
        assertEquals(List.of("Fragment \"P\" cannot be spread here as objects"
                + " of type \"User\" can never be of type \"Post\"."),
                messages("""
                        { user(id: 1) { ...P } }
                        fragment P on Post { title }
                        """));
    }

    @Test
    void whenValidating_givenFragmentCycle_shouldReportItOnce() {
        assertEquals(List.of("Cannot spread fragment \"A\" within itself via"
                + " \"B\"."),
                messages("""
                        { user(id: 1) { ...A } }
                        fragment A on User { name ...B }
                        fragment B on User { id ...A }
                        """));
    }

    @Test
    void whenValidating_givenConflictingAliases_shouldReportIt() {
        assertEquals(List.of("Fields \"x\" conflict because \"name\" and"
                + " \"role\" are different fields. Use different aliases on"
                + " the fields to fetch both if this was intentional."),
                messages("{ user(id: 1) { x: name x: role } }"));
    }

    @Test
    void whenValidating_givenDifferingArguments_shouldReportIt() {
        assertEquals(List.of("Fields \"user\" conflict because they have"
                + " differing arguments. Use different aliases on the fields"
                + " to fetch both if this was intentional."),
                messages("{ user(id: 1) { id } user(id: 2) { id } }"));
    }

    @Test
    void whenValidating_givenSameFieldTwice_shouldMergeIt() {
        assertTrue(messages("{ user(id: 1) { id } user(id: 1) { name } }")
                .isEmpty());
    }

    @Test
    void whenValidating_givenShuffledRules_shouldReturnSameErrors() {
        final String query = """
                query Q($unused: Int, $id: Int) {
                  user(id: $id) { nope x: name x: role ...Missing }
                  hello @nope
                  echo(input: {extra: 1})
                }
                query Q { users }
                """;
        final List<ValidationError> expected = validate(query);

        final List<Function<ValidationContext, ValidationRule>> rules =
                new ArrayList<>(Validator.specifiedRules());
        Collections.shuffle(rules, new Random(42));
        final List<ValidationError> shuffled = new Validator(rules)
                .validate(schema, Parser.parse(query));

        assertTrue(expected.size() > 5, expected.toString());
        assertEquals(expected, shuffled);
    }

    @Test
    void whenValidating_givenDepthLimit_shouldRejectDeepQueries() {
        final List<ValidationError> errors = new Validator(2).validate(
                schema, Parser.parse(
                        "{ user(id: 1) { friends { name } } }"));

        assertEquals(1, errors.size());
        assertEquals("MaxDepth", errors.get(0).rule());
        assertEquals("Query depth 3 exceeds the maximum allowed depth of 2.",
                errors.get(0).message());
    }

    @Test
    void whenValidating_givenDepthWithinLimit_shouldAcceptIt() {
        assertTrue(new Validator(3).validate(schema, Parser.parse(
                "{ user(id: 1) { friends { name } } }")).isEmpty());
    }

    @Test
    void whenConvertingError_givenValidationError_shouldCarryCode() {
        final ValidationError error = validate("{ nope }").get(0);

        assertEquals("GRAPHQL_VALIDATION_FAILED",
                error.toGraphQLError().extensions().get("code"));
        assertEquals(error.locations(), error.toGraphQLError().locations());
    }

    private List<ValidationError> validate(final String query) {
        return new Validator().validate(schema, Parser.parse(query));
    }

    private List<String> messages(final String query) {
        return validate(query).stream()
                .map(ValidationError::message)
                .toList();
    }
}
