package co.fanki.graphql.validation;

import co.fanki.graphql.language.Argument;
import co.fanki.graphql.language.Directive;
import co.fanki.graphql.language.Document;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.SelectionSet;
import co.fanki.graphql.language.Value;
import co.fanki.graphql.language.VariableDefinition;
import co.fanki.graphql.schema.DirectiveLocation;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.validation.rules.FieldsOnCorrectType;
import co.fanki.graphql.validation.rules.FragmentsOnCompositeTypes;
import co.fanki.graphql.validation.rules.KnownArgumentNames;
import co.fanki.graphql.validation.rules.KnownDirectives;
import co.fanki.graphql.validation.rules.KnownFragmentNames;
import co.fanki.graphql.validation.rules.KnownTypeNames;
import co.fanki.graphql.validation.rules.LoneAnonymousOperation;
import co.fanki.graphql.validation.rules.MaxDepth;
import co.fanki.graphql.validation.rules.NoFragmentCycles;
import co.fanki.graphql.validation.rules.NoUndefinedVariables;
import co.fanki.graphql.validation.rules.NoUnusedFragments;
import co.fanki.graphql.validation.rules.NoUnusedVariables;
import co.fanki.graphql.validation.rules.OverlappingFieldsCanBeMerged;
import co.fanki.graphql.validation.rules.PossibleFragmentSpreads;
import co.fanki.graphql.validation.rules.ProvidedRequiredArguments;
import co.fanki.graphql.validation.rules.ScalarLeafs;
import co.fanki.graphql.validation.rules.UniqueArgumentNames;
import co.fanki.graphql.validation.rules.UniqueDirectivesPerLocation;
import co.fanki.graphql.validation.rules.UniqueFragmentNames;
import co.fanki.graphql.validation.rules.UniqueOperationNames;
import co.fanki.graphql.validation.rules.UniqueVariableNames;
import co.fanki.graphql.validation.rules.ValuesOfCorrectType;
import co.fanki.graphql.validation.rules.VariablesAreInputTypes;
import co.fanki.graphql.validation.rules.VariablesInAllowedPosition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Checks a document against a schema before it is executed.
 *
 * <p>Every rule sees the whole document in a single walk and all their
 * errors are returned together. The result is sorted by location, so
 * it does not depend on the order the rules run in.</p>
 *
 * <p>Instances are immutable and can be shared between threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final List<Function<ValidationContext, ValidationRule>> rules;

    /** Creates a validator running the specified rules, with no depth limit. */
    public Validator() {
        this(0);
    }

    /**
     * Creates a validator running the specified rules plus a depth limit.
     *
     * @param maxDepth the deepest field nesting allowed, 0 for no limit
     */
    public Validator(final int maxDepth) {
        this(withDepthLimit(maxDepth));
    }

    /**
     * Creates a validator running the given rules.
     *
     * @param theRules one factory per rule, invoked once per validation
     */
    public Validator(
            final List<Function<ValidationContext, ValidationRule>> theRules) {
        Preconditions.requireNonNull(theRules, "Rules are required");
        this.rules = List.copyOf(theRules);
    }

    /** Returns the factories of the rules every document must pass. */
    public static List<Function<ValidationContext, ValidationRule>>
            specifiedRules() {
        return List.of(
                UniqueOperationNames::new,
                LoneAnonymousOperation::new,
                KnownTypeNames::new,
                FragmentsOnCompositeTypes::new,
                VariablesAreInputTypes::new,
                FieldsOnCorrectType::new,
                ScalarLeafs::new,
                UniqueFragmentNames::new,
                KnownFragmentNames::new,
                NoUnusedFragments::new,
                PossibleFragmentSpreads::new,
                NoFragmentCycles::new,
                UniqueVariableNames::new,
                NoUndefinedVariables::new,
                NoUnusedVariables::new,
                VariablesInAllowedPosition::new,
                KnownDirectives::new,
                UniqueDirectivesPerLocation::new,
                KnownArgumentNames::new,
                UniqueArgumentNames::new,
                ProvidedRequiredArguments::new,
                ValuesOfCorrectType::new,
                OverlappingFieldsCanBeMerged::new);
    }

    private static List<Function<ValidationContext, ValidationRule>>
            withDepthLimit(final int maxDepth) {
        final List<Function<ValidationContext, ValidationRule>> all =
                new ArrayList<>(specifiedRules());
        if (maxDepth > 0) {
            all.add(context -> new MaxDepth(context, maxDepth));
        }
        return all;
    }

    /**
     * Validates a document.
     *
     * @param schema the schema, cannot be null
     * @param document the parsed document, cannot be null
     * @return the errors sorted by location, empty if the document is valid
     */
    public List<ValidationError> validate(final Schema schema,
            final Document document) {
        Preconditions.requireNonNull(schema, "Schema is required");
        Preconditions.requireNonNull(document, "Document is required");

        final ValidationContext context = new ValidationContext(schema,
                document);
        final List<ValidationRule> instances = new ArrayList<>(rules.size());
        for (final Function<ValidationContext, ValidationRule> factory
                : rules) {
            instances.add(factory.apply(context));
        }

        final DocumentWalker walker = new DocumentWalker(schema,
                new RuleDispatcher(instances));
        context.typeInfo(walker.typeInfo());
        walker.walk(document);

        final List<ValidationError> errors = context.errors();
        errors.sort(ValidationError.ORDER);
        LOG.debug("Validated document with {} rules, {} errors",
                instances.size(), errors.size());
        return errors;
    }

    /** Forwards every callback to each rule. */
    private static final class RuleDispatcher implements DocumentVisitor {

        private final List<ValidationRule> rules;

        RuleDispatcher(final List<ValidationRule> theRules) {
            this.rules = theRules;
        }

        @Override
        public void enterDocument(final Document document) {
            rules.forEach(rule -> rule.enterDocument(document));
        }

        @Override
        public void leaveDocument(final Document document) {
            rules.forEach(rule -> rule.leaveDocument(document));
        }

        @Override
        public void enterOperation(final OperationDefinition operation) {
            rules.forEach(rule -> rule.enterOperation(operation));
        }

        @Override
        public void leaveOperation(final OperationDefinition operation) {
            rules.forEach(rule -> rule.leaveOperation(operation));
        }

        @Override
        public void enterFragmentDefinition(
                final FragmentDefinition fragment) {
            rules.forEach(rule -> rule.enterFragmentDefinition(fragment));
        }

        @Override
        public void enterVariableDefinition(
                final VariableDefinition definition) {
            rules.forEach(rule -> rule.enterVariableDefinition(definition));
        }

        @Override
        public void enterSelectionSet(final SelectionSet selectionSet) {
            rules.forEach(rule -> rule.enterSelectionSet(selectionSet));
        }

        @Override
        public void leaveSelectionSet(final SelectionSet selectionSet) {
            rules.forEach(rule -> rule.leaveSelectionSet(selectionSet));
        }

        @Override
        public void enterField(final Field field) {
            rules.forEach(rule -> rule.enterField(field));
        }

        @Override
        public void leaveField(final Field field) {
            rules.forEach(rule -> rule.leaveField(field));
        }

        @Override
        public void enterInlineFragment(final InlineFragment fragment) {
            rules.forEach(rule -> rule.enterInlineFragment(fragment));
        }

        @Override
        public void enterFragmentSpread(final FragmentSpread spread) {
            rules.forEach(rule -> rule.enterFragmentSpread(spread));
        }

        @Override
        public void enterDirectives(final List<Directive> directives,
                final DirectiveLocation location) {
            rules.forEach(rule -> rule.enterDirectives(directives, location));
        }

        @Override
        public void enterDirective(final Directive directive,
                final DirectiveLocation location) {
            rules.forEach(rule -> rule.enterDirective(directive, location));
        }

        @Override
        public void enterArgument(final Argument argument) {
            rules.forEach(rule -> rule.enterArgument(argument));
        }

        @Override
        public void enterVariable(final Value.Variable variable) {
            rules.forEach(rule -> rule.enterVariable(variable));
        }
    }
}
