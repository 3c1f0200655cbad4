package com.llmcommittee.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CommitteeDispatchConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService committeeDispatchExecutor(CommitteeRuntimeProperties committeeRuntimeProperties) {
        CustomizableThreadFactory threadFactory =
                new CustomizableThreadFactory(committeeRuntimeProperties.getDispatch().getThreadNamePrefix());
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public Clock committeeClock() {
        return Clock.systemUTC();
    }
}
