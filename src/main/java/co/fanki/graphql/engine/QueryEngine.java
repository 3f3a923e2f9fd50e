package co.fanki.graphql.engine;

import co.fanki.graphql.execution.ExecutionContext;
import co.fanki.graphql.execution.QueryExecutor;
import co.fanki.graphql.execution.ValuesCoercer;
import co.fanki.graphql.execution.VariableCoercionException;
import co.fanki.graphql.language.Document;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.Parser;
import co.fanki.graphql.language.SyntaxException;
import co.fanki.graphql.schema.CacheControl;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.shared.GraphQLError;
import co.fanki.graphql.shared.GraphQLException;
import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;
import co.fanki.graphql.validation.CacheControlCalculator;
import co.fanki.graphql.validation.ValidationError;
import co.fanki.graphql.validation.Validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Runs requests against a schema: parse, validate, select the
 * operation, coerce the variables, execute and assemble the result.
 *
 * <p>Problems found before execution starts reject the whole request
 * and the result carries no data. The engine is thread safe; one
 * instance serves every request of a schema.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class QueryEngine {

    private static final Logger LOG =
            LoggerFactory.getLogger(QueryEngine.class);

    private final Schema schema;
    private final Executor executor;
    private final EngineSettings settings;
    private final Validator validator;
    private final ValuesCoercer coercer;
    private final QueryExecutor queryExecutor;

    /**
     * Creates a new engine.
     *
     * @param theSchema the schema, cannot be null
     * @param theExecutor runs the resolvers, cannot be null
     * @param theSettings the request limits, cannot be null
     */
    public QueryEngine(final Schema theSchema, final Executor theExecutor,
            final EngineSettings theSettings) {
        this.schema = Preconditions.requireNonNull(theSchema,
                "Schema is required");
        this.executor = Preconditions.requireNonNull(theExecutor,
                "Executor is required");
        this.settings = Preconditions.requireNonNull(theSettings,
                "Settings are required");
        this.validator = new Validator(theSettings.maxDepth());
        this.coercer = new ValuesCoercer(theSchema);
        this.queryExecutor = new QueryExecutor(coercer);
    }

    public Schema schema() {
        return schema;
    }

    /**
     * Runs a request and waits for its result.
     *
     * @param request the request, cannot be null
     * @return the result
     */
    public ExecutionResult execute(final ExecutionRequest request) {
        return executeAsync(request).join();
    }

    /**
     * Runs a request.
     *
     * @param request the request, cannot be null
     * @return the result, completed once every field completed
     */
    public CompletableFuture<ExecutionResult> executeAsync(
            final ExecutionRequest request) {
        Preconditions.requireNonNull(request, "Request is required");
        LOG.debug("Executing operation {}", request.operationName());

        final Document document;
        try {
            document = Parser.parse(request.query());
        } catch (final SyntaxException e) {
            LOG.debug("Rejecting request: {}", e.getMessage());
            return rejected(e, e.getLocation());
        }

        final List<ValidationError> validationErrors =
                validator.validate(schema, document);
        if (!validationErrors.isEmpty()) {
            LOG.debug("Rejecting request with {} validation errors",
                    validationErrors.size());
            return CompletableFuture.completedFuture(ExecutionResult.rejected(
                    validationErrors.stream()
                            .map(ValidationError::toGraphQLError)
                            .toList()));
        }

        final OperationDefinition operation;
        final Map<String, Object> variables;
        try {
            operation = selectOperation(document, request.operationName());
            variables = coercer.coerceVariableValues(operation,
                    request.variables());
        } catch (final VariableCoercionException e) {
            LOG.debug("Rejecting request: {}", e.getMessage());
            return rejected(e, e.getLocation());
        } catch (final GraphQLException e) {
            LOG.debug("Rejecting request: {}", e.getMessage());
            return rejected(e, null);
        }

        final CacheControl cacheControl = new CacheControlCalculator(schema,
                document).calculate(operation);
        final ExecutionContext context = ExecutionContext.newContext()
                .schema(schema)
                .document(document)
                .operation(operation)
                .variables(variables)
                .rootValue(request.rootValue())
                .hostContext(request.context())
                .executor(executor)
                .build();

        final CompletableFuture<Map<String, Object>> data;
        try {
            data = queryExecutor.execute(context);
        } catch (final GraphQLException e) {
            LOG.debug("Rejecting request: {}", e.getMessage());
            return rejected(e, operation.location());
        }
        scheduleTimeout(request, context, data);

        return data.thenApply(result -> {
            final ExecutionResult executed = ExecutionResult.executed(result,
                    context.errors().errors(), cacheControl);
            LOG.debug("Executed operation {} with {} errors",
                    operation.name(), executed.errors().size());
            return executed;
        });
    }

    /**
     * Picks the operation a request runs.
     *
     * @param document the document
     * @param operationName the requested name, may be null
     * @return the operation
     * @throws GraphQLException if the name is missing or unknown
     */
    static OperationDefinition selectOperation(final Document document,
            final String operationName) {
        final List<OperationDefinition> operations = document.operations();
        if (operationName == null || operationName.isBlank()) {
            if (operations.size() == 1) {
                return operations.get(0);
            }
            throw new GraphQLException(operations.isEmpty()
                    ? "Must provide an operation."
                    : "Must provide operation name if query contains"
                            + " multiple operations.",
                    "OPERATION_RESOLUTION_FAILURE");
        }
        final OperationDefinition operation =
                document.operation(operationName);
        if (operation == null) {
            throw new GraphQLException("Unknown operation named \""
                    + operationName + "\".", "OPERATION_RESOLUTION_FAILURE");
        }
        return operation;
    }

    private void scheduleTimeout(final ExecutionRequest request,
            final ExecutionContext context,
            final CompletableFuture<Map<String, Object>> data) {
        final Duration timeout = request.timeout() != null
                ? request.timeout()
                : settings.timeout();
        if (timeout.isZero() || timeout.isNegative() || data.isDone()) {
            return;
        }
        CompletableFuture.delayedExecutor(timeout.toMillis(),
                TimeUnit.MILLISECONDS).execute(() -> {
                    if (!data.isDone()) {
                        LOG.warn("Operation {} timed out after {} ms,"
                                + " cancelling", context.operation().name(),
                                timeout.toMillis());
                        context.cancel();
                    }
                });
    }

    private static CompletableFuture<ExecutionResult> rejected(
            final GraphQLException e, final SourceLocation location) {
        return CompletableFuture.completedFuture(ExecutionResult.rejected(
                List.of(GraphQLError.fromException(e, location == null
                        ? List.of()
                        : List.of(location)))));
    }
}
