package io.intellixity.jobly.api.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.jobly.persistence.jdbc.JdbcQueryExecutor;
import io.intellixity.jobly.persistence.jdbc.QueryExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(DbProperties.class)
public class JoblyConfig {

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(DbProperties props) {
    String url = props.getJdbcUrl();
    if (url == null || url.isBlank()) throw new IllegalArgumentException("Missing jobly.db.jdbc-url");

    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(url);
    hc.setUsername(props.getUsername());
    hc.setPassword(props.getPassword());
    hc.setMaximumPoolSize(props.getMaximumPoolSize());
    hc.setPoolName("jobly");
    return new HikariDataSource(hc);
  }

  @Bean
  public QueryExecutor queryExecutor(DataSource dataSource) {
    return new JdbcQueryExecutor(dataSource);
  }
}
