package com.jreinhal.haven.config;

import com.jreinhal.haven.model.CaseTier;
import com.jreinhal.haven.model.Permission;
import com.jreinhal.haven.model.Role;
import com.jreinhal.haven.model.User;
import com.jreinhal.haven.model.UserStatus;
import com.jreinhal.haven.model.Village;
import com.jreinhal.haven.repository.RoleRepository;
import com.jreinhal.haven.repository.UserRepository;
import com.jreinhal.haven.repository.VillageRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * First-run seeding of the reference roles, villages and a SuperAdmin account.
 *
 * Every step is idempotent by name or email, so restarting with bootstrap enabled is safe.
 */
@Configuration
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);
    static final String SUPER_ADMIN = "SuperAdmin";

    @Value("${app.bootstrap.enabled:false}")
    private boolean bootstrapEnabled;

    @Value("${app.bootstrap.admin-email:superadmin@sos.tn}")
    private String adminEmail;

    @Value("${app.bootstrap.admin-password:}")
    private String adminPassword;

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(10);
    }

    @Bean
    public CommandLineRunner initDatabase(RoleRepository roleRepository, VillageRepository villageRepository,
                                          UserRepository userRepository, PasswordEncoder passwordEncoder) {
        return args -> {
            if (!bootstrapEnabled) {
                log.info("Database bootstrap disabled via configuration");
                return;
            }
            if (adminPassword == null || adminPassword.length() < 8) {
                log.error("==========================================================");
                log.error("  SECURITY ERROR: Bootstrap enabled but no admin password!");
                log.error("  Set app.bootstrap.admin-password (8+ characters).");
                log.error("==========================================================");
                throw new IllegalStateException("app.bootstrap.admin-password is required when bootstrap is enabled");
            }
            for (Role role : referenceRoles()) {
                if (roleRepository.existsByName(role.getName())) {
                    continue;
                }
                roleRepository.save(role);
                log.info("Seeded role {} (tier={}, {} permissions)", role.getName(), role.getTier(), role.getPermissions().size());
            }
            for (Village village : referenceVillages()) {
                if (!villageRepository.existsByName(village.getName())) {
                    villageRepository.save(village);
                    log.info("Seeded village {}", village.getName());
                }
            }
            if (userRepository.existsByEmail(adminEmail)) {
                log.info("Bootstrap admin {} already present", adminEmail);
                return;
            }
            Role superAdmin = roleRepository.findByName(SUPER_ADMIN)
                    .orElseThrow(() -> new IllegalStateException("SuperAdmin role missing after seeding"));
            User admin = new User(adminEmail, passwordEncoder.encode(adminPassword), "Super", "Admin",
                    superAdmin.getId(), null, UserStatus.APPROVED);
            userRepository.save(admin);
            log.warn("==========================================================");
            log.warn("  BOOTSTRAP ADMIN CREATED: {}", adminEmail);
            log.warn("  Change this password after first sign-in.");
            log.warn("==========================================================");
        };
    }

    static List<Role> referenceRoles() {
        return List.of(
                new Role(SUPER_ADMIN, "Full system access - can manage roles and permissions",
                        Permission.catalog(), CaseTier.OVERSIGHT),
                new Role("Mère SOS", "SOS Mother - can create reports and view basic information",
                        List.of("REPORT_CREATE", "REPORT_READ"), CaseTier.REPORTER),
                new Role("Psychologue", "Psychologist - can handle DPE and evaluations",
                        List.of("REPORT_READ", "REPORT_UPDATE", "REPORT_CLASSIFY", "DOC_UPLOAD_DPE",
                                "DOC_UPLOAD_EVALUATION", "DOC_READ", "STATS_VIEW"), CaseTier.ANALYST),
                new Role("Assistant Social", "Social Worker - can create action plans and follow-ups",
                        List.of("REPORT_READ", "REPORT_UPDATE", "DOC_UPLOAD_PLAN_ACTION", "DOC_UPLOAD_SUIVI",
                                "DOC_READ", "STATS_VIEW"), CaseTier.ANALYST),
                new Role("Directeur", "Director - full report management and oversight",
                        List.of("REPORT_READ", "REPORT_UPDATE", "REPORT_ASSIGN", "REPORT_CLASSIFY", "CASE_CLOSE",
                                "DOC_UPLOAD_RAPPORT_FINAL", "DOC_UPLOAD_CLOTURE", "DOC_READ", "DOC_DELETE",
                                "USER_READ", "AUDIT_READ", "STATS_VIEW"), CaseTier.OVERSIGHT),
                new Role("Direction Nationale", "National Bureau - oversight and formal closure decisions",
                        List.of("REPORT_READ", "CASE_CLOSE", "DOC_READ", "USER_READ", "AUDIT_READ", "STATS_VIEW"),
                        CaseTier.REVIEWER));
    }

    static List<Village> referenceVillages() {
        return List.of(
                new Village("Gammarth (Tunis)", "Tunis", "Programme SOS - Tunis"),
                new Village("Akouda (Sousse)", "Sousse", "Programme SOS - Sousse"),
                new Village("Mahrès (Sfax)", "Sfax", "Programme SOS - Sfax"),
                new Village("Siliana", "Siliana", "Programme SOS - Siliana"));
    }
}
