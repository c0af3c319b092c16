package io.intellixity.paging.examples.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.paging.exec.DataEngine;
import io.intellixity.paging.jdbc.JdbcDataEngine;
import io.intellixity.paging.jdbc.dialect.JdbcDialect;
import io.intellixity.paging.jdbc.dialect.PostgresDialect;
import io.intellixity.paging.jdbc.dialect.StandardSqlDialect;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Locale;

@Configuration
@EnableConfigurationProperties(ExampleDbProperties.class)
public class PagingExampleConfig {

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(ExampleDbProperties props) {
    String url = props.getJdbcUrl();
    if (url == null || url.isBlank()) throw new IllegalArgumentException("Missing example.db.jdbc-url");

    HikariConfig hc = new HikariConfig();
    hc.setPoolName("paging-examples");
    hc.setJdbcUrl(url);
    hc.setUsername(props.getUsername());
    hc.setPassword(props.getPassword());
    hc.setMaximumPoolSize(props.getMaximumPoolSize());
    return new HikariDataSource(hc);
  }

  @Bean
  public JdbcDialect jdbcDialect(ExampleDbProperties props) {
    String d = props.getDialect() == null ? "standard" : props.getDialect().trim().toLowerCase(Locale.ROOT);
    return switch (d) {
      case "standard" -> new StandardSqlDialect();
      case "postgres" -> new PostgresDialect();
      default -> throw new IllegalArgumentException("Unsupported example.db.dialect: " + props.getDialect());
    };
  }

  @Bean
  public DataEngine dataEngine(DataSource dataSource, JdbcDialect dialect) {
    return new JdbcDataEngine(dataSource, dialect);
  }
}
