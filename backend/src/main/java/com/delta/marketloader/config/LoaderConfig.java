package com.delta.marketloader.config;

import com.delta.marketloader.ingest.cache.CacheStore;
import com.delta.marketloader.ingest.cache.InMemoryCacheStore;
import com.delta.marketloader.ingest.cache.JdbcCacheStore;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import com.delta.marketloader.ingest.service.BlockingPersistenceRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class LoaderConfig {
    private static final Logger log = LoggerFactory.getLogger(LoaderConfig.class);

    @Bean(name = "fetchExecutor", destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(LoaderProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatch().getMaxConcurrent());
    }

    @Bean(name = "persistenceExecutor", destroyMethod = "shutdown")
    public ExecutorService persistenceExecutor(LoaderProperties properties) {
        int size = Math.max(2, properties.getBatch().getMaxConcurrent());
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(LoaderProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "loadRunExecutor", destroyMethod = "shutdown")
    public ExecutorService loadRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheStore cacheStore(
        LoaderProperties properties,
        LoaderJdbcRepository repository,
        BlockingPersistenceRunner persistenceRunner,
        Clock clock
    ) {
        if ("memory".equals(properties.getCache().getBackend())) {
            log.info("Using in-memory response cache");
            return new InMemoryCacheStore(clock);
        }
        return new JdbcCacheStore(repository, persistenceRunner, clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
