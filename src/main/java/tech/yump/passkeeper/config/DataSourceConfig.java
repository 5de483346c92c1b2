package tech.yump.passkeeper.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.util.Arrays;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataSourceConfig {

    private static final String POOL_NAME = "PassKeeperPostgresPool";

    private final PassKeeperProperties properties;

    @Bean(destroyMethod = "close")
    @Primary
    public DataSource dataSource() {
        PassKeeperProperties.DataSourceProperties dbProps = properties.datasource();
        log.info("Configuring Hikari DataSource for {}", dbProps.url());

        // Work on a copy so the configured array survives for a context refresh
        char[] passwordChars = dbProps.password().clone();
        try {
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(dbProps.url());
            config.setUsername(dbProps.username());
            // HikariConfig has no char[] setter
            config.setPassword(new String(passwordChars));
            config.setDriverClassName("org.postgresql.Driver");
            config.setPoolName(POOL_NAME);
            config.setMaximumPoolSize(dbProps.maximumPoolSize());
            config.setMinimumIdle(Math.min(2, dbProps.maximumPoolSize()));
            config.setConnectionTimeout(dbProps.connectionTimeout().toMillis());

            HikariDataSource dataSource = new HikariDataSource(config);
            log.info("HikariDataSource '{}' configured: user {}, max pool size {}, connection timeout {}",
                    POOL_NAME, config.getUsername(), config.getMaximumPoolSize(), dbProps.connectionTimeout());
            return dataSource;
        } catch (RuntimeException e) {
            log.error("Failed to configure DataSource: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to configure DataSource", e);
        } finally {
            Arrays.fill(passwordChars, '\0');
            log.debug("Local copy of DB password char array cleared from memory.");
        }
    }
}
