package io.intellixity.paging.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "example.db")
public class ExampleDbProperties {
  private String jdbcUrl;
  private String username;
  private String password;
  private int maximumPoolSize = 10;

  /** SQL dialect: {@code standard} (H2 and other SQL:2008 databases) or {@code postgres}. */
  private String dialect = "standard";

  public String getJdbcUrl() { return jdbcUrl; }
  public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
  public String getUsername() { return username; }
  public void setUsername(String username) { this.username = username; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  public int getMaximumPoolSize() { return maximumPoolSize; }
  public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  public String getDialect() { return dialect; }
  public void setDialect(String dialect) { this.dialect = dialect; }
}
