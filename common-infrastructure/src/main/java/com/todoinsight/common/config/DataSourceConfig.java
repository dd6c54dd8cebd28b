package com.todoinsight.common.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.hibernate.cfg.AvailableSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * 类说明 / Class Description:
 * 中文：集中式数据源配置，根据 todo.database.* 选择 MySQL 或内嵌 H2，并构建 HikariCP 连接池。
 * English: Centralized DataSource configuration choosing MySQL or embedded H2 from todo.database.*
 * and building a HikariCP pool.
 *
 * 使用场景 / Use Cases:
 * 中文：为待办服务提供唯一的共享连接池，持久化模块负责其初始化与释放。
 * English: Provide the single shared pool of the todo service; the persistence module owns its init and release.
 *
 * 设计目的 / Design Purpose:
 * 中文：连接池构建时不连接数据库，启动期的首次连接由持久化模块的 init() 完成。
 * English: The pool does not connect when built; the first connection at startup is made by the
 * persistence module's init().
 *
 * 涉及的核心组件说明 / Core Components:
 * 中文：TodoDatabaseProperties、HikariConfig/HikariDataSource、Hibernate 方言定制。
 * English: TodoDatabaseProperties, HikariConfig/HikariDataSource, Hibernate dialect customization.
 */
@Configuration
@EnableConfigurationProperties(TodoDatabaseProperties.class)
public class DataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    static final String MYSQL_DRIVER = "com.mysql.cj.jdbc.Driver";
    static final String H2_DRIVER = "org.h2.Driver";
    static final String MYSQL_DIALECT = "org.hibernate.dialect.MySQLDialect";
    static final String H2_DIALECT = "org.hibernate.dialect.H2Dialect";

    /**
     * 方法说明 / Method Description:
     * 中文：绑定 spring.datasource.hikari.* 到 HikariConfig，用于配置连接池参数。
     * English: Bind spring.datasource.hikari.* to HikariConfig for connection pool parameters.
     *
     * 返回值 / Return:
     * 中文说明：Hikari 连接池配置对象
     * English description: Hikari connection pool configuration object
     */
    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariConfig hikariConfig() {
        return new HikariConfig();
    }

    /**
     * 方法说明 / Method Description:
     * 中文：根据是否配置了 MySQL 主机，构建对应的 HikariDataSource。
     * English: Build the HikariDataSource for MySQL when a host is configured, otherwise for embedded H2.
     *
     * 参数 / Parameters:
     * @param properties 中文说明：数据库连接设置 / English description: database settings
     * @param hikari     中文说明：连接池参数 / English description: pool parameters
     *
     * 返回值 / Return:
     * 中文说明：尚未建立物理连接的连接池
     * English description: A pool that has not opened a physical connection yet
     *
     * 异常 / Exceptions:
     * 中文/英文：密钥文件不可读时抛出 IllegalStateException
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean
    public DataSource dataSource(TodoDatabaseProperties properties, HikariConfig hikari) {
        if (properties.isMySqlConfigured()) {
            hikari.setJdbcUrl(properties.mysqlJdbcUrl());
            hikari.setUsername(properties.resolveUser());
            hikari.setPassword(properties.resolvePassword());
            hikari.setDriverClassName(MYSQL_DRIVER);
            log.info("Using MySQL database {} at {}:{}", properties.resolveName(), properties.resolveHost(),
                    properties.getPort());
        } else {
            hikari.setJdbcUrl(properties.getEmbeddedUrl());
            hikari.setUsername("sa");
            hikari.setPassword("");
            hikari.setDriverClassName(H2_DRIVER);
            log.info("No MySQL host configured, using embedded database {}", properties.getEmbeddedUrl());
        }
        return new HikariDataSource(hikari);
    }

    /**
     * 方法说明 / Method Description:
     * 中文：显式指定 Hibernate 方言并禁止启动期读取 JDBC 元数据，避免 EntityManagerFactory 提前连接数据库。
     * English: Pin the Hibernate dialect and disable JDBC metadata access at boot so the
     * EntityManagerFactory does not connect ahead of the persistence module.
     */
    @Bean
    public HibernatePropertiesCustomizer todoDialectCustomizer(TodoDatabaseProperties properties) {
        String dialect = properties.isMySqlConfigured() ? MYSQL_DIALECT : H2_DIALECT;
        return hibernateProperties -> {
            hibernateProperties.put(AvailableSettings.DIALECT, dialect);
            hibernateProperties.put("hibernate.boot.allow_jdbc_metadata_access", false);
        };
    }
}
