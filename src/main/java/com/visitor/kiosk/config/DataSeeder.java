package com.visitor.kiosk.config;

import com.visitor.kiosk.entity.AdminUser;
import com.visitor.kiosk.entity.Host;
import com.visitor.kiosk.repository.AdminUserRepository;
import com.visitor.kiosk.repository.HostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Idempotent seeder: creates the dashboard admin account and a few demo
 * hosts when their tables are empty. Safe to re-run.
 */
@Configuration
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    @Value("${kiosk.seed.enabled:true}")
    private boolean enabled;

    @Value("${kiosk.admin.username:admin}")
    private String adminUsername;

    @Value("${kiosk.admin.password:admin}")
    private String adminPassword;

    @Value("${kiosk.admin.full-name:Kiosk Administrator}")
    private String adminFullName;

    @Bean
    CommandLineRunner seedData(AdminUserRepository adminUserRepo, HostRepository hostRepo) {
        return args -> {
            if (!enabled) {
                log.info("Seeding disabled, skipping");
                return;
            }

            if (adminUserRepo.findByUsername(adminUsername).isEmpty()) {
                adminUserRepo.save(AdminUser.builder()
                        .username(adminUsername)
                        .hashedPassword(sha256Hex(adminPassword))
                        .fullName(adminFullName)
                        .active(true)
                        .build());
                log.info("Seeded admin user '{}'", adminUsername);
            }

            if (hostRepo.count() > 0) {
                log.info("Hosts already seeded, skipping");
                return;
            }
            List<Host> hosts = List.of(
                    Host.builder().fullName("Alice Johnson").email("alice.johnson@example.com")
                            .department("Engineering").build(),
                    Host.builder().fullName("Bob Martinez").email("bob.martinez@example.com")
                            .department("Sales").build(),
                    Host.builder().fullName("Carol Nguyen").email("carol.nguyen@example.com")
                            .department("Human Resources").build()
            );
            hostRepo.saveAll(hosts);
            log.info("Seeded {} demo hosts", hosts.size());
        };
    }

    static String sha256Hex(String raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
