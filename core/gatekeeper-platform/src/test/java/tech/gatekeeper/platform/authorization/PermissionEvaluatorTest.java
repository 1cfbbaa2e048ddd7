package tech.gatekeeper.platform.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static tech.gatekeeper.platform.test.Principals.ADMIN;
import static tech.gatekeeper.platform.test.Principals.EDITOR;
import static tech.gatekeeper.platform.test.Principals.VIEWER;

/**
 * Unit tests for PermissionEvaluator decision rules.
 */
class PermissionEvaluatorTest {

    private final PermissionEvaluator evaluator = new PermissionEvaluator(CapabilityMatrix.defaults());

    // ========================================
    // ALL SCOPE
    // ========================================

    @Test
    @DisplayName("evaluate should allow ALL-scoped grant regardless of owner")
    void evaluate_shouldAllow_whenScopeAll() {
        assertThat(evaluator.evaluate(VIEWER, PermissionRequest.of(Resource.PRODUCTS, Action.READ))).isTrue();
        assertThat(evaluator.evaluate(VIEWER, PermissionRequest.of(Resource.PRODUCTS, Action.READ, "someone-else"))).isTrue();
        assertThat(evaluator.evaluate(EDITOR, PermissionRequest.of(Resource.PAGES, Action.DELETE, "editor-1"))).isTrue();
    }

    @Test
    @DisplayName("evaluate should deny when no grant matches")
    void evaluate_shouldDeny_whenNoGrant() {
        assertThat(evaluator.evaluate(VIEWER, PermissionRequest.of(Resource.PRODUCTS, Action.CREATE))).isFalse();
        assertThat(evaluator.evaluate(EDITOR, PermissionRequest.of(Resource.USERS, Action.READ))).isFalse();
    }

    @Test
    @DisplayName("evaluate should allow ADMIN everything")
    void evaluate_shouldAllowAdminEverything() {
        for (Resource resource : Resource.values()) {
            for (Action action : Action.values()) {
                assertThat(evaluator.evaluate(ADMIN, PermissionRequest.of(resource, action))).isTrue();
            }
        }
    }

    // ========================================
    // OWN SCOPE
    // ========================================

    @Test
    @DisplayName("evaluate should allow OWN-scoped grant only for the owner")
    void evaluate_shouldRequireOwnership_whenScopeOwn() {
        assertThat(evaluator.evaluate(VIEWER, PermissionRequest.of(Resource.PROFILE, Action.UPDATE, "viewer-1"))).isTrue();
        assertThat(evaluator.evaluate(VIEWER, PermissionRequest.of(Resource.PROFILE, Action.UPDATE, "editor-1"))).isFalse();
    }

    @Test
    @DisplayName("evaluate should deny OWN-scoped grant when no owner is supplied")
    void evaluate_shouldDeny_whenScopeOwnAndCapabilityOnly() {
        assertThat(evaluator.evaluate(VIEWER, PermissionRequest.of(Resource.PROFILE, Action.READ))).isFalse();
        assertThat(evaluator.capabilityScope(Role.VIEWER, Resource.PROFILE, Action.READ)).contains(Scope.OWN);
    }

    // ========================================
    // PRINCIPAL STATE
    // ========================================

    @Test
    @DisplayName("evaluate should deny inactive and missing principals")
    void evaluate_shouldDeny_whenPrincipalInactive() {
        Principal suspended = Principal.inactive("admin-2", Role.ADMIN);

        assertThat(evaluator.evaluate(suspended, PermissionRequest.of(Resource.PRODUCTS, Action.READ))).isFalse();
        assertThat(evaluator.evaluate(null, PermissionRequest.of(Resource.PRODUCTS, Action.READ))).isFalse();
    }

    @Test
    @DisplayName("hasMinimumRole should compare ranks for active principals")
    void hasMinimumRole_shouldCompareRanks() {
        assertThat(evaluator.hasMinimumRole(EDITOR, Role.VIEWER)).isTrue();
        assertThat(evaluator.hasMinimumRole(VIEWER, Role.EDITOR)).isFalse();
        assertThat(evaluator.hasMinimumRole(Principal.inactive("a", Role.ADMIN), Role.VIEWER)).isFalse();
    }
}
