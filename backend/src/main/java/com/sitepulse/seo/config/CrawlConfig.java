package com.sitepulse.seo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CrawlConfig {

    @Bean(name = "crawlExecutor", destroyMethod = "shutdownNow")
    public ExecutorService crawlExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getHttpThreads());
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public WebMvcConfigurer crawlStreamingConfigurer(
        CrawlerProperties properties,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor
    ) {
        return new WebMvcConfigurer() {
            @Override
            public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
                // Each streamed crawl holds one of these threads for its whole lifetime.
                configurer.setTaskExecutor(new TaskExecutorAdapter(crawlExecutor));
                configurer.setDefaultTimeout(Duration.ofSeconds(properties.getStreamTimeoutSeconds()).toMillis());
            }
        };
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
