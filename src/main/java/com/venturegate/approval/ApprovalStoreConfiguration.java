package com.venturegate.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Selects the approval store with {@code venturegate.approvals.store}: {@code jdbc} uses the
 * application {@link DataSource}; anything else keeps requests in memory.
 */
@Configuration
public class ApprovalStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ApprovalStoreConfiguration.class);

    @Bean
    @ConditionalOnProperty(prefix = "venturegate.approvals", name = "store", havingValue = "jdbc")
    public ApprovalStore jdbcApprovalStore(DataSource dataSource) throws SQLException {
        log.info("Configuring JDBC approval store");
        JdbcApprovalStore store = new JdbcApprovalStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(ApprovalStore.class)
    public ApprovalStore inMemoryApprovalStore() {
        log.info("Using in-memory approval store (requests will not persist across restarts)");
        return new InMemoryApprovalStore();
    }
}
