package com.pumainbox.api.config;

import lombok.Getter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection settings for the inbox database, bound once at startup from
 * {@code DB_HOST}, {@code DB_PORT}, {@code DB_NAME}, {@code DB_USER} and {@code DB_PASSWORD}.
 */
@Getter
@ToString(exclude = "password")
@ConfigurationProperties(prefix = "inbox.db")
public class DatabaseProperties {

    private final String host;
    private final int port;
    private final String name;
    private final String user;
    private final String password;
    private final String schema;

    public DatabaseProperties(String host,
                              @DefaultValue("5432") int port,
                              String name,
                              String user,
                              String password,
                              @DefaultValue("Puma_L1_AI") String schema) {
        this.host = host;
        this.port = port;
        this.name = name;
        this.user = user;
        this.password = password;
        this.schema = schema;
    }

    // stringtype=unspecified lets the server type string parameters (timestamps, json)
    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + name + "?stringtype=unspecified";
    }
}
