package com.mco.core.state;

import com.mco.core.config.McoProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring {@link Configuration} that provides the {@link StateStore} bean selected by
 * {@code mco.state.backend}.
 * <p>
 * {@code memory} (the default) keeps state in-process and loses it on restart;
 * {@code file} writes one JSON document per orchestration; {@code jdbc} stores
 * the same documents in a database table through its own connection pool.
 */
@Configuration
public class StateStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StateStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "mco.state.backend", havingValue = "memory", matchIfMissing = true)
    public StateStore inMemoryStateStore() {
        log.info("Using in-memory state store (state will not persist across restarts)");
        return new InMemoryStateStore();
    }

    @Bean
    @ConditionalOnProperty(name = "mco.state.backend", havingValue = "file")
    public StateStore fileStateStore(McoProperties properties) {
        log.info("Configuring file state store in {}", properties.getStateDirectory());
        return new FileStateStore(Path.of(properties.getStateDirectory()));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "mco.state.backend", havingValue = "jdbc")
    public HikariDataSource stateDataSource(McoProperties properties) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(properties.getJdbcUrl());
        config.setUsername(properties.getJdbcUsername());
        config.setPassword(properties.getJdbcPassword());
        config.setPoolName("mco-state");
        return new HikariDataSource(config);
    }

    /**
     * JDBC-backed state store. Creates the required table on startup.
     */
    @Bean
    @ConditionalOnProperty(name = "mco.state.backend", havingValue = "jdbc")
    public StateStore jdbcStateStore(HikariDataSource stateDataSource, McoProperties properties) {
        log.info("Configuring JDBC state store ({}, table {})", properties.getJdbcUrl(), properties.getJdbcTable());
        var store = new JdbcStateStore(stateDataSource, properties.getJdbcTable());
        store.createTable();
        return store;
    }
}
