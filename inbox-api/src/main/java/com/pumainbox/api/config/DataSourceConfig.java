package com.pumainbox.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Slf4j
@Configuration
public class DataSourceConfig {

    /**
     * Unpooled: every {@code getConnection()} opens a fresh physical connection,
     * which the JDBC template closes when the statement completes.
     */
    @Bean
    public DataSource inboxDataSource(DatabaseProperties properties) {
        log.info("Configuring inbox database connection. Url: {}, User: {}, Schema: {}",
                properties.jdbcUrl(), properties.getUser(), properties.getSchema());

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.postgresql.Driver");
        dataSource.setUrl(properties.jdbcUrl());
        dataSource.setUsername(properties.getUser());
        dataSource.setPassword(properties.getPassword());
        return dataSource;
    }

    @Bean
    public NamedParameterJdbcTemplate inboxJdbcTemplate(DataSource inboxDataSource) {
        return new NamedParameterJdbcTemplate(inboxDataSource);
    }
}
