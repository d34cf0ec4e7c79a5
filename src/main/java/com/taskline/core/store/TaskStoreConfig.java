package com.taskline.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Spring {@link Configuration} that provides the {@link TaskStore} bean.
 * <p>
 * With {@code taskline.store.type=jdbc} (the {@code postgres} profile) a
 * {@link JdbcTaskStore} is created over the configured {@link DataSource}.
 * Otherwise an {@link InMemoryTaskStore} is used -- suitable for development
 * and testing but not durable across restarts.
 */
@Configuration
public class TaskStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskStoreConfig.class);

    /**
     * JDBC-backed task store. Creates the required database table on startup.
     */
    @Bean
    @ConditionalOnProperty(name = "taskline.store.type", havingValue = "jdbc")
    public TaskStore jdbcTaskStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) throws Exception {
        log.info("Configuring JDBC task store");
        var store = new JdbcTaskStore(dataSource, objectMapper, clock);
        store.createTables();
        return store;
    }

    /**
     * In-memory fallback task store. State is lost on application restart.
     */
    @Bean
    @ConditionalOnProperty(name = "taskline.store.type", havingValue = "memory", matchIfMissing = true)
    public TaskStore inMemoryTaskStore(Clock clock) {
        log.info("Using in-memory task store (tasks will not persist across restarts)");
        return new InMemoryTaskStore(clock);
    }
}
