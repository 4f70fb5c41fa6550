package com.jreinhal.haven.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jreinhal.haven.model.CaseTier;
import com.jreinhal.haven.model.Permission;
import com.jreinhal.haven.model.Role;
import com.jreinhal.haven.model.User;
import com.jreinhal.haven.model.UserStatus;
import com.jreinhal.haven.model.Village;
import com.jreinhal.haven.repository.RoleRepository;
import com.jreinhal.haven.repository.UserRepository;
import com.jreinhal.haven.repository.VillageRepository;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

class DataInitializerTest {

    private RoleRepository roleRepository;
    private VillageRepository villageRepository;
    private UserRepository userRepository;
    private PasswordEncoder passwordEncoder;
    private DataInitializer initializer;

    @BeforeEach
    void setUp() {
        roleRepository = mock(RoleRepository.class);
        villageRepository = mock(VillageRepository.class);
        userRepository = mock(UserRepository.class);
        passwordEncoder = mock(PasswordEncoder.class);
        when(passwordEncoder.encode(anyString())).thenReturn("hashed");
        initializer = new DataInitializer();
        ReflectionTestUtils.setField(initializer, "adminEmail", "superadmin@sos.tn");
    }

    private CommandLineRunner runner() {
        return initializer.initDatabase(roleRepository, villageRepository, userRepository, passwordEncoder);
    }

    @Test
    void referenceRolesCarryTheirTiers() {
        Map<String, Role> roles = DataInitializer.referenceRoles().stream()
                .collect(Collectors.toMap(Role::getName, Function.identity()));

        assertThat(roles.get("Mère SOS").getTier()).isEqualTo(CaseTier.REPORTER);
        assertThat(roles.get("Psychologue").getTier()).isEqualTo(CaseTier.ANALYST);
        assertThat(roles.get("Assistant Social").getTier()).isEqualTo(CaseTier.ANALYST);
        assertThat(roles.get("Directeur").getTier()).isEqualTo(CaseTier.OVERSIGHT);
        assertThat(roles.get("Direction Nationale").getTier()).isEqualTo(CaseTier.REVIEWER);
        assertThat(roles.get("SuperAdmin").getPermissions()).containsExactlyInAnyOrderElementsOf(Permission.catalog());
    }

    @Test
    void referenceRolesOnlyUseCatalogPermissions() {
        assertThat(DataInitializer.referenceRoles())
                .flatExtracting(Role::getPermissions)
                .allSatisfy(name -> assertThat(Permission.isKnown(name)).as(name).isTrue());
    }

    @Test
    void disabledBootstrapTouchesNothing() throws Exception {
        ReflectionTestUtils.setField(initializer, "bootstrapEnabled", false);

        runner().run();

        verifyNoInteractions(roleRepository, villageRepository, userRepository);
    }

    @Test
    void bootstrapWithoutPasswordFails() {
        ReflectionTestUtils.setField(initializer, "bootstrapEnabled", true);
        ReflectionTestUtils.setField(initializer, "adminPassword", "short");

        assertThatThrownBy(() -> runner().run()).isInstanceOf(IllegalStateException.class);
        verify(roleRepository, never()).save(any());
    }

    @Test
    void bootstrapSeedsMissingDataAndApprovedAdmin() throws Exception {
        ReflectionTestUtils.setField(initializer, "bootstrapEnabled", true);
        ReflectionTestUtils.setField(initializer, "adminPassword", "ChangeMe123");
        when(roleRepository.existsByName("Directeur")).thenReturn(true);
        Role superAdmin = new Role("SuperAdmin", null, Permission.catalog(), CaseTier.OVERSIGHT);
        superAdmin.setId("role-admin");
        when(roleRepository.findByName("SuperAdmin")).thenReturn(Optional.of(superAdmin));

        runner().run();

        verify(roleRepository, times(5)).save(any(Role.class));
        verify(villageRepository, times(4)).save(any(Village.class));
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(UserStatus.APPROVED);
        assertThat(captor.getValue().getRoleId()).isEqualTo("role-admin");
        assertThat(captor.getValue().getPasswordHash()).isEqualTo("hashed");
    }
}
