package co.fanki.graphql.execution;

import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.OperationType;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.schema.EnumType;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.schema.ObjectType;
import co.fanki.graphql.schema.PropertyResolver;
import co.fanki.graphql.schema.Resolver;
import co.fanki.graphql.schema.ScalarType;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.shared.GraphQLError;
import co.fanki.graphql.shared.GraphQLException;
import co.fanki.graphql.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Executes a validated operation and produces the response data.
 *
 * <p>Query fields resolve concurrently on the request executor and a
 * selection set completes once all of its fields did. Mutation root
 * fields run one after the other, in document order. The response keeps
 * the field collection order regardless of completion order.</p>
 *
 * <p>Errors are recorded in the request's {@link ErrorCollector} exactly
 * once. A failed value at a non-null position makes the nearest
 * nullable field or list element null instead.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class QueryExecutor {

    private static final Logger LOG =
            LoggerFactory.getLogger(QueryExecutor.class);

    /** The message of fields skipped after cancellation. */
    public static final String ABORTED_MESSAGE = "Execution aborted";

    private final FieldCollector fieldCollector;
    private final ValuesCoercer coercer;

    /**
     * Creates a new executor.
     *
     * @param theCoercer the coercer of arguments, cannot be null
     */
    public QueryExecutor(final ValuesCoercer theCoercer) {
        this.coercer = Preconditions.requireNonNull(theCoercer,
                "Coercer is required");
        this.fieldCollector = new FieldCollector(theCoercer);
    }

    /**
     * Executes the operation of the context.
     *
     * @param context the request, cannot be null
     * @return the data, completed with null when an error reached the
     *         root
     * @throws GraphQLException if the operation cannot be executed at
     *         all, e.g. a subscription
     */
    public CompletableFuture<Map<String, Object>> execute(
            final ExecutionContext context) {
        Preconditions.requireNonNull(context, "Context is required");
        final OperationDefinition operation = context.operation();

        if (operation.operation() == OperationType.SUBSCRIPTION) {
            throw new GraphQLException("Subscription operations are not"
                    + " supported.", "SUBSCRIPTION_NOT_SUPPORTED");
        }
        final ObjectType rootType = context.schema().rootType(
                operation.operation());
        if (rootType == null) {
            throw new GraphQLException("Schema is not configured to execute "
                    + operation.operation().name().toLowerCase()
                    + " operations.", "OPERATION_NOT_SUPPORTED");
        }

        final Map<String, List<Field>> fields;
        try {
            fields = fieldCollector.collectFields(context, rootType,
                    operation.selectionSet());
        } catch (final GraphQLException e) {
            LOG.debug("Root selection of {} failed", operation.name(), e);
            context.errors().add(new GraphQLError(e.getMessage(),
                    List.of(operation.location()), List.of(),
                    e.getErrorCode() == null
                            ? Map.of()
                            : Map.of("code", e.getErrorCode())));
            return CompletableFuture.completedFuture(null);
        }
        final CompletableFuture<Map<String, Object>> data =
                operation.operation() == OperationType.MUTATION
                        ? executeSerially(context, rootType,
                                context.rootValue(), fields)
                        : executeFields(context, rootType,
                                context.rootValue(), fields,
                                ResultPath.root());

        return data.handle((result, error) -> {
            if (error == null) {
                return result;
            }
            final Throwable cause = unwrap(error);
            if (cause instanceof FieldFailure) {
                return null;
            }
            throw new CompletionException(cause);
        });
    }

    // -- Selection sets ------------------------------------------------------

    private CompletableFuture<Map<String, Object>> executeFields(
            final ExecutionContext context, final ObjectType type,
            final Object source, final Map<String, List<Field>> fields,
            final ResultPath path) {
        final Map<String, CompletableFuture<Object>> pending =
                new LinkedHashMap<>();
        for (final Map.Entry<String, List<Field>> entry : fields.entrySet()) {
            pending.put(entry.getKey(), executeField(context, type, source,
                    entry.getValue(), path.key(entry.getKey())));
        }
        return CompletableFuture.allOf(pending.values()
                .toArray(new CompletableFuture<?>[0]))
                .handle((ignored, error) -> {
                    final Map<String, Object> result = new LinkedHashMap<>();
                    for (final Map.Entry<String, CompletableFuture<Object>>
                            entry : pending.entrySet()) {
                        result.put(entry.getKey(), entry.getValue().join());
                    }
                    return result;
                });
    }

    private CompletableFuture<Map<String, Object>> executeSerially(
            final ExecutionContext context, final ObjectType type,
            final Object source, final Map<String, List<Field>> fields) {
        CompletableFuture<Map<String, Object>> chain =
                CompletableFuture.completedFuture(new LinkedHashMap<>());
        for (final Map.Entry<String, List<Field>> entry : fields.entrySet()) {
            chain = chain.thenCompose(result -> executeField(context, type,
                    source, entry.getValue(),
                    ResultPath.root().key(entry.getKey()))
                    .thenApply(value -> {
                        result.put(entry.getKey(), value);
                        return result;
                    }));
        }
        return chain;
    }

    // -- Fields --------------------------------------------------------------

    private CompletableFuture<Object> executeField(
            final ExecutionContext context, final ObjectType parentType,
            final Object source, final List<Field> fields,
            final ResultPath path) {
        final FieldDefinition definition = context.schema().fieldDefinition(
                parentType, fields.get(0).name());
        if (definition == null) {
            return CompletableFuture.completedFuture(null);
        }
        final FieldStep step = new FieldStep(parentType, definition, fields);

        final CompletableFuture<Object> value;
        if (context.isCancelled()) {
            value = CompletableFuture.failedFuture(abort(context, step, path));
        } else {
            value = resolve(context, step, source, path).thenCompose(
                    resolved -> completeValue(context, step,
                            definition.type(), resolved, path));
        }
        return definition.type().isNonNull() ? value : nullOnFailure(value);
    }

    private CompletableFuture<Object> resolve(final ExecutionContext context,
            final FieldStep step, final Object source, final ResultPath path) {
        final Map<String, Object> arguments;
        try {
            arguments = coercer.coerceArgumentValues(
                    step.definition().arguments(), step.field().arguments(),
                    context.variables());
        } catch (final GraphQLException e) {
            return CompletableFuture.failedFuture(
                    fieldError(context, step, path, e));
        }

        final Resolver resolver = step.definition().resolver();
        final DefaultResolverContext resolverContext =
                new DefaultResolverContext(context, step.parentType(),
                        step.definition(), step.fields(), path);

        final CompletableFuture<Object> result;
        if (resolver == PropertyResolver.INSTANCE) {
            result = invokeInline(resolver, source, arguments,
                    resolverContext);
        } else {
            final CompletableFuture<Object> invocation =
                    CompletableFuture.supplyAsync(() -> invoke(resolver,
                            source, arguments, resolverContext),
                            context.executor());
            context.track(invocation);
            result = invocation.thenCompose(QueryExecutor::flatten);
            context.track(result);
        }

        return result.handle((value, error) -> error == null
                ? CompletableFuture.<Object>completedFuture(value)
                : CompletableFuture.<Object>failedFuture(
                        fieldError(context, step, path, unwrap(error))))
                .thenCompose(Function.identity());
    }

    private static CompletableFuture<Object> invokeInline(
            final Resolver resolver, final Object source,
            final Map<String, Object> arguments,
            final DefaultResolverContext resolverContext) {
        try {
            return flatten(resolver.resolve(source, arguments,
                    resolverContext));
        } catch (final Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Object invoke(final Resolver resolver, final Object source,
            final Map<String, Object> arguments,
            final DefaultResolverContext resolverContext) {
        try {
            return resolver.resolve(source, arguments, resolverContext);
        } catch (final Exception e) {
            throw new CompletionException(e);
        }
    }

    @SuppressWarnings("unchecked")
    private static CompletableFuture<Object> flatten(final Object result) {
        if (result instanceof CompletionStage<?> stage) {
            return ((CompletionStage<Object>) stage).toCompletableFuture();
        }
        return CompletableFuture.completedFuture(result);
    }

    // -- Value completion ----------------------------------------------------

    private CompletableFuture<Object> completeValue(
            final ExecutionContext context, final FieldStep step,
            final TypeRef type, final Object value, final ResultPath path) {
        if (type instanceof TypeRef.NonNull nonNull) {
            return completeValue(context, step, nonNull.ofType(), value, path)
                    .thenCompose(completed -> completed != null
                            ? CompletableFuture.<Object>completedFuture(completed)
                            : CompletableFuture.<Object>failedFuture(fieldError(
                                    context, step, path,
                                    "Cannot return null for non-nullable"
                                            + " field " + step.coordinate()
                                            + ".", null)));
        }
        if (value == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (type instanceof TypeRef.ListOf listOf) {
            return completeList(context, step, listOf.ofType(), value, path);
        }

        final TypeDefinition definition = context.schema().type(type);
        if (definition instanceof ScalarType || definition instanceof EnumType) {
            return completeLeaf(context, step, definition, value, path);
        }
        final ObjectType objectType;
        if (definition instanceof ObjectType object) {
            objectType = object;
        } else {
            try {
                objectType = context.schema().resolveObjectType(definition,
                        value, new DefaultResolverContext(context,
                                step.parentType(), step.definition(),
                                step.fields(), path));
            } catch (final GraphQLException e) {
                return CompletableFuture.failedFuture(
                        fieldError(context, step, path, e));
            }
        }
        final Map<String, List<Field>> subfields;
        try {
            subfields = fieldCollector.collectSubfields(context, objectType,
                    step.fields());
        } catch (final GraphQLException e) {
            return CompletableFuture.failedFuture(
                    fieldError(context, step, path, e));
        }
        return executeFields(context, objectType, value, subfields, path)
                .thenApply(data -> data);
    }

    private CompletableFuture<Object> completeList(
            final ExecutionContext context, final FieldStep step,
            final TypeRef itemType, final Object value,
            final ResultPath path) {
        final List<Object> items = ValuesCoercer.asList(value);
        if (items == null) {
            return CompletableFuture.failedFuture(fieldError(context, step,
                    path, "Expected Iterable, but did not find one for field "
                            + step.coordinate() + ".", null));
        }
        final List<CompletableFuture<Object>> pending =
                new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            final CompletableFuture<Object> item = completeValue(context,
                    step, itemType, items.get(i), path.index(i));
            pending.add(itemType.isNonNull() ? item : nullOnFailure(item));
        }
        return CompletableFuture.allOf(pending
                .toArray(new CompletableFuture<?>[0]))
                .handle((ignored, error) -> {
                    final List<Object> result = new ArrayList<>(pending.size());
                    for (final CompletableFuture<Object> item : pending) {
                        result.add(item.join());
                    }
                    return result;
                });
    }

    private static CompletableFuture<Object> completeLeaf(
            final ExecutionContext context, final FieldStep step,
            final TypeDefinition definition, final Object value,
            final ResultPath path) {
        try {
            final Object serialized = definition instanceof ScalarType scalar
                    ? scalar.coercing().serialize(value)
                    : ((EnumType) definition).serialize(value);
            return CompletableFuture.completedFuture(serialized);
        } catch (final RuntimeException e) {
            return CompletableFuture.failedFuture(
                    fieldError(context, step, path, e));
        }
    }

    // -- Errors --------------------------------------------------------------

    /** Turns a recorded failure into null at a nullable position. */
    private static CompletableFuture<Object> nullOnFailure(
            final CompletableFuture<Object> value) {
        return value.handle((result, error) -> {
            if (error == null) {
                return result;
            }
            final Throwable cause = unwrap(error);
            if (cause instanceof FieldFailure) {
                return null;
            }
            throw new CompletionException(cause);
        });
    }

    private static FieldFailure fieldError(final ExecutionContext context,
            final FieldStep step, final ResultPath path,
            final Throwable error) {
        if (error instanceof FieldFailure failure) {
            return failure;
        }
        if (error instanceof CancellationException) {
            return abort(context, step, path);
        }
        LOG.debug("Field {} failed at {}", step.coordinate(), path, error);
        final String message = error.getMessage() == null
                ? error.getClass().getName()
                : error.getMessage();
        return fieldError(context, step, path, message,
                error instanceof GraphQLException e ? e.getErrorCode() : null);
    }

    private static FieldFailure fieldError(final ExecutionContext context,
            final FieldStep step, final ResultPath path, final String message,
            final String code) {
        context.errors().add(new GraphQLError(message,
                List.of(step.field().location()), path.toList(),
                code == null ? Map.of() : Map.of("code", code)));
        return new FieldFailure(path);
    }

    private static FieldFailure abort(final ExecutionContext context,
            final FieldStep step, final ResultPath path) {
        return fieldError(context, step, path, ABORTED_MESSAGE,
                "EXECUTION_ABORTED");
    }

    private static Throwable unwrap(final Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /** The field being executed: its parent type, definition and nodes. */
    private record FieldStep(ObjectType parentType, FieldDefinition definition,
            List<Field> fields) {

        Field field() {
            return fields.get(0);
        }

        String coordinate() {
            return parentType.name() + "." + definition.name();
        }
    }
}
