package com.llmcommittee.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class BackendHttpClientConfig {

    @Bean
    public OkHttpClient backendHttpClient(BackendProviderProperties backendProviderProperties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(backendProviderProperties.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(backendProviderProperties.getCallTimeoutSeconds()))
                .callTimeout(Duration.ofSeconds(backendProviderProperties.getCallTimeoutSeconds()))
                .build();
    }
}
