package com.flagship.vacation_ledger.account;

import com.flagship.vacation_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.security.crypto.password.PasswordEncoder;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The bootstrap manager migration, replayed on the emptied tables.
 */
class BootstrapManagerSeedTest extends PostgresIntegrationTest {

    private static final String SEED_SCRIPT = "db/migration/V3__seed_manager.sql";

    @Autowired
    private DataSource dataSource;

    @Autowired
    private PasswordEncoder passwordEncoder;

    private void runSeedScript() {
        new ResourceDatabasePopulator(new ClassPathResource(SEED_SCRIPT)).execute(dataSource);
    }

    @Test
    @DisplayName("Seeded manager hash matches the documented password")
    void seededHashMatchesDocumentedPassword() {
        printTestHeader("Bootstrap manager seed");
        runSeedScript();

        String hash = jdbcTemplate.queryForObject(
            "SELECT password_hash FROM accounts WHERE email = 'manager@company.com' AND role = 'MANAGER'",
            String.class);

        printOutput("Hash", hash);
        assertTrue(passwordEncoder.matches("ChangeMe123!", hash));
        assertFalse(passwordEncoder.matches("changeme123!", hash));
        printSuccess("Precomputed hash is accepted by the application's encoder");
    }

    @Test
    @DisplayName("Seed needs no database extension and is safe to replay")
    void seedIsSelfContainedAndIdempotent() {
        runSeedScript();
        runSeedScript();

        Integer managers = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE employee_code = '1000001'", Integer.class);
        Integer pgcrypto = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM pg_extension WHERE extname = 'pgcrypto'", Integer.class);

        assertEquals(1, managers);
        assertEquals(0, pgcrypto, "Migrations must run under a role that cannot create extensions");
    }
}
