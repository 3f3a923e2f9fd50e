package co.fanki.graphql.config;

import co.fanki.graphql.engine.EngineSettings;
import co.fanki.graphql.engine.QueryEngine;
import co.fanki.graphql.engine.ResponseAssembler;
import co.fanki.graphql.schema.Schema;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires a {@link QueryEngine} for the {@link Schema} the host
 * application declares as a bean.
 *
 * <p>Registered as auto-configuration, so it runs after the host's own
 * configuration. Resolvers run on a dedicated fixed pool. Setting
 * {@code graphql.enabled} to {@code false} turns the whole
 * configuration off.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "graphql.enabled", havingValue = "true",
        matchIfMissing = true)
public class GraphQLConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphQLConfiguration.class);

    /**
     * Creates the pool running the resolvers.
     *
     * @param threads the pool size
     * @return the executor, shut down with the context
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService graphqlExecutor(
            @Value("${graphql.executor.threads:8}") final int threads) {
        LOG.info("Starting resolver pool with {} threads", threads);
        final AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            final Thread thread = new Thread(runnable,
                    "graphql-resolver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Creates the request limits.
     *
     * @param maxDepth the deepest nesting allowed, 0 for no limit
     * @param timeoutMillis the request deadline, 0 for none
     * @return the settings
     */
    @Bean
    public EngineSettings engineSettings(
            @Value("${graphql.max-depth:0}") final int maxDepth,
            @Value("${graphql.timeout-millis:0}") final long timeoutMillis) {
        return new EngineSettings(maxDepth, Duration.ofMillis(timeoutMillis));
    }

    /**
     * Creates the engine.
     *
     * @param schema the host schema
     * @param executor the resolver pool
     * @param settings the request limits
     * @return the engine
     */
    @Bean
    @ConditionalOnBean(Schema.class)
    public QueryEngine queryEngine(final Schema schema,
            @Qualifier("graphqlExecutor") final ExecutorService executor,
            final EngineSettings settings) {
        LOG.info("Creating query engine, max depth {}, timeout {}",
                settings.maxDepth(), settings.timeout());
        return new QueryEngine(schema, executor, settings);
    }

    /**
     * Creates the response assembler, using the application's object
     * mapper when there is one.
     *
     * @param objectMapper the application's mapper
     * @return the assembler
     */
    @Bean
    public ResponseAssembler responseAssembler(
            final ObjectProvider<ObjectMapper> objectMapper) {
        return new ResponseAssembler(objectMapper.getIfAvailable(
                ObjectMapper::new));
    }
}
