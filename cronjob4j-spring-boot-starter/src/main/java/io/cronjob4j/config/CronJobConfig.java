package io.cronjob4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronjob4j.JobDefinitionService;
import io.cronjob4j.JobScheduler;
import io.cronjob4j.TaskFactory;
import io.cronjob4j.core.ConcurrencyGovernor;
import io.cronjob4j.core.JobDefinition;
import io.cronjob4j.core.JobStore;
import io.cronjob4j.core.TaskRegistry;
import io.cronjob4j.errors.PersistenceException;
import io.cronjob4j.internal.PollingJobScheduler;
import io.cronjob4j.internal.mongo.MongoJobStore;
import io.cronjob4j.tasks.DataCleanupTaskFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the cron job scheduler.
 */
@AutoConfiguration
@ConditionalOnClass({JobScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "cronjob", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronJobConfig {
    private static final Logger log = LoggerFactory.getLogger(CronJobConfig.class);

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected CronJobMongoIndexConfig cronJobMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new CronJobMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public DataCleanupTaskFactory dataCleanupTaskFactory(SchedulerProperties props) {
        return new DataCleanupTaskFactory(props.getRetention().getRetentionDays(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRegistry taskRegistry(ObjectProvider<List<TaskFactory<?>>> factoriesProvider,
                                     ObjectProvider<ObjectMapper> objectMapperProvider) {
        List<TaskFactory<?>> factories = factoriesProvider.getIfAvailable(List::of);
        return new TaskRegistry(factories, objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ConcurrencyGovernor concurrencyGovernor() {
        return new ConcurrencyGovernor();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(SchedulerProperties props,
                                     JobStore jobStore,
                                     TaskRegistry registry,
                                     ConcurrencyGovernor governor) {
        return new PollingJobScheduler(props, jobStore, registry, governor);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobDefinitionService jobDefinitionService(JobStore jobStore, SchedulerProperties props) {
        return new JobDefinitionService(jobStore, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(JobScheduler scheduler, SchedulerProperties props) {
        return new SchedulerLifecycle(scheduler, props.isAutoStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronjob", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton cronJobIndexesInitializer(CronJobMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronjob.retention", name = "enabled", havingValue = "true")
    public SmartInitializingSingleton cronJobRetentionRegistrar(JobDefinitionService service, SchedulerProperties props) {
        return () -> registerRetentionJob(service, props.getRetention());
    }

    static void registerRetentionJob(JobDefinitionService service, SchedulerProperties.Retention retention) {
        JobDefinition cleanup = service.newDefinition(retention.getJobName(), DataCleanupTaskFactory.TASK_TYPE, retention.getCron())
                .put("retentionDays", retention.getRetentionDays())
                .maxRetries(0)
                .description("Deletes execution history older than " + retention.getRetentionDays() + " days")
                .createdBy("cronjob4j")
                .build();
        try {
            JobDefinition saved = service.registerIfAbsent(cleanup);
            log.info("cronjob retention job registered name={} cron={}", saved.name(), saved.cronExpression());
        } catch (PersistenceException e) {
            log.error("cronjob could not register retention job name={} msg={}", retention.getJobName(), e.getMessage(), e);
        }
    }
}
