package com.mockbuster.server.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * PostgreSQL 접속 설정. application.yml 에서 DB_* 환경 변수로 채워진다.
 * 값이 비어 있으면 기본값을 사용한다.
 */
@ConfigurationProperties(prefix = "mockbuster.database")
public record DatabaseProperties(
        String host,
        String port,
        String user,
        String password,
        String name,
        Integer maxPoolSize
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final String DEFAULT_PORT = "5432";
    public static final String DEFAULT_USER = "postgres";
    public static final String DEFAULT_PASSWORD = "postgres";
    public static final String DEFAULT_NAME = "dvdrental";
    public static final int DEFAULT_MAX_POOL_SIZE = 10;

    public DatabaseProperties {
        host = orDefault(host, DEFAULT_HOST);
        port = orDefault(port, DEFAULT_PORT);
        user = orDefault(user, DEFAULT_USER);
        password = orDefault(password, DEFAULT_PASSWORD);
        name = orDefault(name, DEFAULT_NAME);
        maxPoolSize = maxPoolSize == null || maxPoolSize <= 0 ? DEFAULT_MAX_POOL_SIZE : maxPoolSize;
    }

    public static DatabaseProperties defaults() {
        return new DatabaseProperties(null, null, null, null, null, null);
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + name;
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
