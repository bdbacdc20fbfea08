package io.pingjob.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pingjob.Automator;
import io.pingjob.JobExecutor;
import io.pingjob.JobScheduler;
import io.pingjob.JobStore;
import io.pingjob.codec.JobConfigCodec;
import io.pingjob.internal.DefaultAutomator;
import io.pingjob.internal.http.HttpJobExecutor;
import io.pingjob.internal.mongo.MongoJobStore;
import io.pingjob.internal.quartz.QuartzJobScheduler;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for the ping job Automator.
 */
@AutoConfiguration
@ConditionalOnClass({Automator.class, MongoTemplate.class})
@EnableConfigurationProperties(PingJobProperties.class)
@ConditionalOnProperty(prefix = "pingjob", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PingJobConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobStore pingJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler pingJobScheduler(PingJobProperties props) {
        return QuartzJobScheduler.create(props.getSchedulerName(), props.getWorkerThreads(), props.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobConfigCodec jobConfigCodec(PingJobProperties props) {
        return new JobConfigCodec(props.secretKeyBytes());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(name = "pingJobHttpClient")
    public CloseableHttpClient pingJobHttpClient(PingJobProperties props) {
        return HttpJobExecutor.defaultClient(props.getDefaultProbeTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor pingJobExecutor(CloseableHttpClient pingJobHttpClient,
                                       ObjectProvider<ObjectMapper> objectMapper,
                                       PingJobProperties props) {
        return new HttpJobExecutor(pingJobHttpClient,
                objectMapper.getIfAvailable(ObjectMapper::new),
                props.getDefaultProbeTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public Automator automator(PingJobProperties props,
                               JobStore store,
                               JobScheduler scheduler,
                               JobConfigCodec codec,
                               JobExecutor executor) {
        return new DefaultAutomator(store, scheduler, codec, executor, props.getJobSetName(), props.getReconcileEvery());
    }

    @Bean
    @ConditionalOnMissingBean
    public PingJobLifecycle pingJobLifecycle(Automator automator) {
        return new PingJobLifecycle(automator);
    }
}
