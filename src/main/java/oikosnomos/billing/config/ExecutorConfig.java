package oikosnomos.billing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded worker pools. No pool runs rejected work on the caller thread:
 * a full queue raises TaskRejectedException, which callers log and count.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "persistenceExecutor")
    public ThreadPoolTaskExecutor persistenceExecutor(BillingProperties properties) {
        BillingProperties.Persistence persistence = properties.getPersistence();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("persist-");
        executor.setCorePoolSize(persistence.getCoreSize());
        executor.setMaxPoolSize(persistence.getMaxSize());
        executor.setQueueCapacity(persistence.getQueueCapacity());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        // PersistenceDispatcher drains the pool itself on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "billingExecutor")
    public ThreadPoolTaskExecutor billingExecutor(BillingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("billing-");
        executor.setCorePoolSize(properties.getBillingThreads());
        executor.setMaxPoolSize(properties.getBillingThreads());
        executor.setQueueCapacity(properties.getBillingQueueCapacity());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /** Single publisher thread, so a stalled broker socket never holds a billing thread. */
    @Bean(name = "publishExecutor")
    public ThreadPoolTaskExecutor publishExecutor(BillingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("publish-");
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(properties.getMqtt().getPublishQueueCapacity());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
