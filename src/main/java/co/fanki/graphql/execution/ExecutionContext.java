package co.fanki.graphql.execution;

import co.fanki.graphql.language.Document;
import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.schema.ObjectType;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * The state of one request while it executes.
 *
 * <p>Shared by every resolver of the request, on whatever thread they
 * run, so everything mutable here is thread safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ExecutionContext {

    private static final Logger LOG =
            LoggerFactory.getLogger(ExecutionContext.class);

    private final Schema schema;
    private final Document document;
    private final OperationDefinition operation;
    private final Map<String, FragmentDefinition> fragments;
    private final Map<String, Object> variables;
    private final Object rootValue;
    private final Object hostContext;
    private final Executor executor;
    private final ErrorCollector errors = new ErrorCollector();

    private final Set<CompletableFuture<?>> inFlight =
            ConcurrentHashMap.newKeySet();
    private final Map<String, Boolean> typeConditions =
            new ConcurrentHashMap<>();
    private volatile boolean cancelled;

    private ExecutionContext(final Builder builder) {
        this.schema = Preconditions.requireNonNull(builder.schema,
                "Schema is required");
        this.document = Preconditions.requireNonNull(builder.document,
                "Document is required");
        this.operation = Preconditions.requireNonNull(builder.operation,
                "Operation is required");
        this.executor = Preconditions.requireNonNull(builder.executor,
                "Executor is required");
        this.fragments = document.fragments();
        this.variables = builder.variables == null
                ? Map.of()
                : builder.variables;
        this.rootValue = builder.rootValue;
        this.hostContext = builder.hostContext;
    }

    /** Creates a builder. */
    public static Builder newContext() {
        return new Builder();
    }

    public Schema schema() {
        return schema;
    }

    public Document document() {
        return document;
    }

    public OperationDefinition operation() {
        return operation;
    }

    /**
     * Finds a fragment of the document.
     *
     * @param name the fragment name
     * @return the fragment, or null
     */
    public FragmentDefinition fragment(final String name) {
        return fragments.get(name);
    }

    /** Returns the coerced variables. */
    public Map<String, Object> variables() {
        return variables;
    }

    public Object rootValue() {
        return rootValue;
    }

    public Object hostContext() {
        return hostContext;
    }

    public Executor executor() {
        return executor;
    }

    public ErrorCollector errors() {
        return errors;
    }

    // -- Type conditions -----------------------------------------------------

    /**
     * Tells whether a fragment type condition applies to an object type.
     * Answers are cached for the rest of the request.
     *
     * @param typeCondition the condition, null meaning no condition
     * @param type the runtime object type
     * @return true if the fragment applies
     */
    public boolean typeConditionMatches(final String typeCondition,
            final ObjectType type) {
        if (typeCondition == null) {
            return true;
        }
        return typeConditions.computeIfAbsent(
                typeCondition + "/" + type.name(), key -> {
                    final TypeDefinition condition =
                            schema.type(typeCondition);
                    if (condition == null) {
                        return false;
                    }
                    return condition.name().equals(type.name())
                            || condition.isAbstract()
                                    && schema.isPossibleType(condition, type);
                });
    }

    // -- Cancellation --------------------------------------------------------

    /**
     * Cancels the request. Running resolver futures are cancelled and
     * no further resolver is started.
     */
    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        LOG.debug("Cancelling operation {}, {} resolvers in flight",
                operation.name(), inFlight.size());
        for (final CompletableFuture<?> future : inFlight) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers a running resolver future so {@link #cancel()} reaches
     * it. The future is forgotten once it completes.
     *
     * @param future the future
     */
    void track(final CompletableFuture<?> future) {
        inFlight.add(future);
        future.whenComplete((value, error) -> inFlight.remove(future));
        if (cancelled) {
            future.cancel(true);
        }
    }

    /** Builds {@link ExecutionContext} instances. */
    public static final class Builder {

        private Schema schema;
        private Document document;
        private OperationDefinition operation;
        private Map<String, Object> variables;
        private Object rootValue;
        private Object hostContext;
        private Executor executor;

        private Builder() {
        }

        public Builder schema(final Schema theSchema) {
            schema = theSchema;
            return this;
        }

        public Builder document(final Document theDocument) {
            document = theDocument;
            return this;
        }

        public Builder operation(final OperationDefinition theOperation) {
            operation = theOperation;
            return this;
        }

        /** Sets the variables, already coerced. */
        public Builder variables(final Map<String, Object> theVariables) {
            variables = theVariables;
            return this;
        }

        public Builder rootValue(final Object theRootValue) {
            rootValue = theRootValue;
            return this;
        }

        public Builder hostContext(final Object theHostContext) {
            hostContext = theHostContext;
            return this;
        }

        public Builder executor(final Executor theExecutor) {
            executor = theExecutor;
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(this);
        }
    }
}
