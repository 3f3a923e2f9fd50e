package co.fanki.graphql.config;

import co.fanki.graphql.TestSchema;
import co.fanki.graphql.engine.EngineSettings;
import co.fanki.graphql.engine.ExecutionRequest;
import co.fanki.graphql.engine.ExecutionResult;
import co.fanki.graphql.engine.QueryEngine;
import co.fanki.graphql.engine.ResponseAssembler;
import co.fanki.graphql.schema.Schema;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphQLConfiguration}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphQLConfigurationTest {

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withConfiguration(
                    AutoConfigurations.of(GraphQLConfiguration.class));

    @Test
    void whenStarting_givenSchemaBean_shouldCreateEngine() {
        runner.withUserConfiguration(SchemaConfig.class).run(context -> {
            assertEquals(1, context.getBeansOfType(QueryEngine.class).size());
            assertNotNull(context.getBean(ResponseAssembler.class));
            assertNotNull(context.getBean("graphqlExecutor",
                    ExecutorService.class));

            final QueryEngine engine = context.getBean(QueryEngine.class);
            final ExecutionResult result = engine.execute(
                    ExecutionRequest.of("{ hello }"));

            assertFalse(result.hasErrors());
            assertEquals(Map.of("hello", "world"), result.data());
        });
    }

    @Test
    void whenStarting_givenNoProperties_shouldUseDefaultSettings() {
        runner.withUserConfiguration(SchemaConfig.class).run(context -> {
            final EngineSettings settings =
                    context.getBean(EngineSettings.class);

            assertEquals(0, settings.maxDepth());
            assertFalse(settings.hasTimeout());
        });
    }

    @Test
    void whenStarting_givenLimitProperties_shouldApplyThem() {
        runner.withUserConfiguration(SchemaConfig.class)
                .withPropertyValues("graphql.max-depth=3",
                        "graphql.timeout-millis=250",
                        "graphql.executor.threads=2")
                .run(context -> {
                    final EngineSettings settings =
                            context.getBean(EngineSettings.class);

                    assertEquals(3, settings.maxDepth());
                    assertEquals(Duration.ofMillis(250), settings.timeout());
                    assertTrue(settings.hasTimeout());
                });
    }

    @Test
    void whenStarting_givenNoSchemaBean_shouldNotCreateEngine() {
        runner.run(context -> {
            assertTrue(context.getBeansOfType(QueryEngine.class).isEmpty());
            assertNotNull(context.getBean(ResponseAssembler.class));
        });
    }

    @Test
    void whenStarting_givenDisabled_shouldNotCreateAnyBean() {
        runner.withUserConfiguration(SchemaConfig.class)
                .withPropertyValues("graphql.enabled=false")
                .run(context -> {
                    assertTrue(context.getBeansOfType(
                            QueryEngine.class).isEmpty());
                    assertTrue(context.getBeansOfType(
                            ResponseAssembler.class).isEmpty());
                    assertTrue(context.getBeansOfType(
                            EngineSettings.class).isEmpty());
                });
    }

    @Configuration
    static class SchemaConfig {

        @Bean
        Schema schema() {
            return new TestSchema().schema();
        }
    }
}
