package io.jobs4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.JobDescriptor;
import io.jobs4j.Jobs;
import io.jobs4j.core.JobsConfiguration;
import io.jobs4j.internal.JobsRuntime;
import io.jobs4j.internal.mongo.MongoJobQueue;
import io.jobs4j.internal.mongo.MongoJobStore;
import io.jobs4j.internal.mongo.MongoLockProvider;
import io.jobs4j.spi.JobQueue;
import io.jobs4j.spi.JobStore;
import io.jobs4j.spi.LockProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for jobs components.
 *
 * <p>Every {@link JobDescriptor} bean becomes a configured job. The queue list comes from
 * {@code jobs.queues} unless a {@link JobsConfiguration} bean is supplied.
 */
@AutoConfiguration
@ConditionalOnClass({Jobs.class, MongoTemplate.class})
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "jobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobsConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "jobs")
    public JobsProperties jobsProperties() {
        return new JobsProperties();
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected JobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(JobQueue.class)
    protected JobQueue mongoJobQueue(MongoTemplate mongoTemplate) {
        return new MongoJobQueue(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(LockProvider.class)
    protected LockProvider mongoLockProvider(MongoTemplate mongoTemplate) {
        return new MongoLockProvider(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected JobsMongoIndexConfig jobsMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new JobsMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public Jobs jobs(JobsProperties props,
                     JobStore store,
                     JobQueue queue,
                     LockProvider locks,
                     ObjectProvider<ObjectMapper> objectMapperProvider,
                     ObjectProvider<JobsConfiguration> configurationProvider,
                     ObjectProvider<List<JobDescriptor<?>>> descriptorsProvider) {
        JobsConfiguration configuration = configurationProvider.getIfAvailable(() -> JobsConfiguration.builder()
                .queues(props.getQueues())
                .jobs(descriptorsProvider.getIfAvailable(List::of))
                .build());

        return JobsRuntime.builder()
                .properties(props)
                .configuration(configuration)
                .store(store)
                .queue(queue)
                .locks(locks)
                .objectMapper(objectMapperProvider.getIfAvailable(ObjectMapper::new))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobsLifecycle jobsLifecycle(Jobs jobs, JobsProperties props) {
        return new JobsLifecycle(jobs, props.isAutoStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobs", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton jobsIndexesInitializer(JobsMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
