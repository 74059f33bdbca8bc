package com.koni.thermoguard.infrastructure.web.security;

import com.koni.thermoguard.domain.exception.ForbiddenException;
import com.koni.thermoguard.domain.exception.ValidationException;
import com.koni.thermoguard.domain.model.Actor;
import com.koni.thermoguard.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@UnitTest
class CallerTest {

    private final UUID userId = UUID.randomUUID();

    @Test
    void shouldAllowOperatorToControlDevices() {
        Actor actor = Caller.fromHeaders(userId.toString(), "operator").requireDeviceControl();

        assertThat(actor.isSystem()).isFalse();
        assertThat(actor.getUserId()).contains(userId);
    }

    @Test
    void shouldForbidViewerFromControllingDevices() {
        Caller caller = Caller.fromHeaders(userId.toString(), "viewer");

        assertThatThrownBy(caller::requireDeviceControl)
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("User is not allowed to control devices");
    }

    @Test
    void shouldRequireUserIdEvenForAdmin() {
        Caller caller = Caller.fromHeaders(null, "admin");

        assertThatThrownBy(caller::requireDeviceControl).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(caller::requireAdmin).isInstanceOf(ForbiddenException.class);
    }

    @Test
    void shouldRestrictAdminOperationsToAdmins() {
        Caller.fromHeaders(userId.toString(), "ADMIN").requireAdmin();

        assertThatThrownBy(() -> Caller.fromHeaders(userId.toString(), "operator").requireAdmin())
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void shouldTreatUnknownRoleAsNoRole() {
        Caller caller = Caller.fromHeaders(userId.toString(), "superuser");

        assertThat(caller.getRole()).isEmpty();
        assertThat(caller.requireUser()).isEqualTo(userId);
    }

    @Test
    void shouldRejectMalformedUserId() {
        assertThatThrownBy(() -> Caller.fromHeaders("not-a-uuid", "admin"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining(Caller.USER_ID_HEADER);
    }
}
