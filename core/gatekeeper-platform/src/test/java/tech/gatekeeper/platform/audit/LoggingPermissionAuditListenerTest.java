package tech.gatekeeper.platform.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.gatekeeper.platform.authorization.Action;
import tech.gatekeeper.platform.authorization.Resource;
import tech.gatekeeper.platform.authorization.Role;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LoggingPermissionAuditListenerTest {

    private static PermissionDecision decision(boolean granted, String ownerId) {
        return PermissionDecision.builder()
            .principalId("editor-1")
            .role(Role.EDITOR)
            .resource(Resource.PROFILE)
            .action(Action.UPDATE)
            .resourceOwnerId(ownerId)
            .granted(granted)
            .source(DecisionSource.EVALUATOR)
            .time(Instant.now())
            .build();
    }

    @Test
    @DisplayName("describe should include outcome, principal, permission and source")
    void describe_shouldSummarizeDecision() {
        assertThat(decision(false, "viewer-1").describe())
            .isEqualTo("DENIED editor-1 [EDITOR] profile:update (owner viewer-1) via EVALUATOR");
        assertThat(decision(true, null).describe())
            .isEqualTo("GRANTED editor-1 [EDITOR] profile:update via EVALUATOR");
    }

    @Test
    @DisplayName("listener should accept grants and denials with any configuration")
    void onDecision_shouldHandleAllConfigurations() {
        LoggingPermissionAuditListener verbose = new LoggingPermissionAuditListener(true, true);
        LoggingPermissionAuditListener silent = new LoggingPermissionAuditListener(false, false);

        assertThatCode(() -> {
            verbose.onDecision(decision(true, null));
            verbose.onDecision(decision(false, "viewer-1"));
            silent.onDecision(decision(false, null));
        }).doesNotThrowAnyException();
        assertThat(verbose.logsGrants()).isTrue();
        assertThat(silent.logsDenials()).isFalse();
    }
}
