package io.jobs4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.JobDescriptor;
import io.jobs4j.JobHandler;
import io.jobs4j.Jobs;
import io.jobs4j.core.JobsConfigurationException;
import io.jobs4j.spi.JobStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobsAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JobsConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean("demoJob", JobDescriptor.class,
                    () -> JobDescriptor.builder(new DemoJobHandler()).queue("demo").build())
            .withPropertyValues(
                    "jobs.enabled=true",
                    "jobs.auto-startup=false",
                    "jobs.worker-id=test-worker",
                    "jobs.queues=demo",
                    "jobs.poll-interval=500ms",
                    "jobs.lock-safety-margin=5s"
            );

    @Test
    void shouldAutoConfigureJobsBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(Jobs.class);
            assertThat(context).hasSingleBean(JobsLifecycle.class);
            assertThat(context).hasSingleBean(JobsProperties.class);
            assertThat(context).hasSingleBean(JobStore.class);
            assertThat(context).doesNotHaveBean("jobsIndexesInitializer");

            JobsProperties props = context.getBean(JobsProperties.class);
            assertThat(props.getPollInterval()).isEqualTo(Duration.ofMillis(500));
            assertThat(props.getLockSafetyMargin()).isEqualTo(Duration.ofSeconds(5));
            assertThat(props.getQueues()).containsExactly("demo");
            assertThat(context.getBean(Jobs.class).isRunning()).isFalse();
        });
    }

    @Test
    void undeclaredQueueShouldFailStartup() {
        contextRunner
                .withPropertyValues("jobs.queues=other")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause().isInstanceOf(JobsConfigurationException.class);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("jobs.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(Jobs.class));
    }

    @Test
    void shouldEnsureIndexesWhenRequested() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        IndexOperations indexOps = mock(IndexOperations.class);
        when(mongoTemplate.indexOps(any(Class.class))).thenReturn(indexOps);

        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(JobsConfig.class))
                .withBean(MongoTemplate.class, () -> mongoTemplate)
                .withBean("demoJob", JobDescriptor.class,
                        () -> JobDescriptor.builder(new DemoJobHandler()).queue("demo").build())
                .withPropertyValues(
                        "jobs.auto-startup=false",
                        "jobs.queues=demo",
                        "jobs.ensure-indexes-on-startup=true"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    verify(indexOps, times(4)).ensureIndex(any(IndexDefinition.class));
                });
    }

    @Test
    void indexDefinitionsShouldMatchQueries() {
        assertThat(JobsMongoIndexConfig.queueClaimIndex().getIndexKeys().keySet())
                .containsExactly("queue", "state", "runAt");
        assertThat(JobsMongoIndexConfig.queueStalledIndex().getIndexKeys().keySet())
                .containsExactly("queue", "state", "lockUntil");
        assertThat(JobsMongoIndexConfig.dedupExpiresIndex().getIndexOptions())
                .containsKey("expireAfterSeconds");
    }

    static class DemoJobHandler implements JobHandler<String> {
        @Override
        public String name() {
            return "demo-job";
        }

        @Override
        public Class<String> dataClass() {
            return String.class;
        }

        @Override
        public void execute(String data) {
            // no-op for context bootstrap test
        }
    }
}
