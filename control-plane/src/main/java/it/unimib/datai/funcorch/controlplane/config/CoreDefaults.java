package it.unimib.datai.funcorch.controlplane.config;

import it.unimib.datai.funcorch.controlplane.execution.BackoffPolicy;
import it.unimib.datai.funcorch.controlplane.execution.ExecutionContextFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreDefaults {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionContextFactory.class)
    public ExecutionContextFactory executionContextFactory() {
        return ExecutionContextFactory.standard();
    }

    @Bean
    @ConditionalOnMissingBean(BackoffPolicy.class)
    public BackoffPolicy backoffPolicy(RetryProperties retryProperties) {
        return retryProperties.backoffPolicy();
    }
}
