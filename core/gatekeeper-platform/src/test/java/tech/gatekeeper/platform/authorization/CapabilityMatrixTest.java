package tech.gatekeeper.platform.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityMatrixTest {

    private final CapabilityMatrix matrix = CapabilityMatrix.defaults();

    @Nested
    @DisplayName("Default matrix")
    class Defaults {

        @Test
        @DisplayName("ADMIN should manage every resource at ALL scope")
        void admin_shouldManageEverything() {
            for (Resource resource : Resource.values()) {
                for (Action action : Action.values()) {
                    assertThat(matrix.scopeFor(Role.ADMIN, resource, action))
                        .as("%s:%s", resource, action)
                        .contains(Scope.ALL);
                }
            }
        }

        @Test
        @DisplayName("EDITOR should manage content but only read orders")
        void editor_shouldManageContent() {
            assertThat(matrix.scopeFor(Role.EDITOR, Resource.PRODUCTS, Action.DELETE)).contains(Scope.ALL);
            assertThat(matrix.scopeFor(Role.EDITOR, Resource.MEDIA, Action.CREATE)).contains(Scope.ALL);
            assertThat(matrix.scopeFor(Role.EDITOR, Resource.ORDERS, Action.READ)).contains(Scope.ALL);
            assertThat(matrix.scopeFor(Role.EDITOR, Resource.ORDERS, Action.UPDATE)).isEmpty();
            assertThat(matrix.scopeFor(Role.EDITOR, Resource.USERS, Action.READ)).isEmpty();
        }

        @Test
        @DisplayName("VIEWER should read content and manage only its own profile")
        void viewer_shouldReadContent() {
            assertThat(matrix.scopeFor(Role.VIEWER, Resource.PRODUCTS, Action.READ)).contains(Scope.ALL);
            assertThat(matrix.scopeFor(Role.VIEWER, Resource.PRODUCTS, Action.CREATE)).isEmpty();
            assertThat(matrix.scopeFor(Role.VIEWER, Resource.PROFILE, Action.UPDATE)).contains(Scope.OWN);
            assertThat(matrix.scopeFor(Role.VIEWER, Resource.SETTINGS, Action.READ)).isEmpty();
        }

        @Test
        @DisplayName("higher roles should not inherit grants implicitly")
        void grants_shouldNotBeInherited() {
            CapabilityMatrix onlyViewer = CapabilityMatrix.builder()
                .grant(Role.VIEWER, Resource.PAGES, Action.READ, Scope.ALL)
                .build();

            assertThat(onlyViewer.scopeFor(Role.EDITOR, Resource.PAGES, Action.READ)).isEmpty();
            assertThat(onlyViewer.grantsFor(Role.ADMIN)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("scopeFor should prefer ALL when both ALL and OWN grants match")
        void scopeFor_shouldPreferWidest() {
            CapabilityMatrix mixed = CapabilityMatrix.builder()
                .grant(Role.EDITOR, Resource.PAGES, Action.UPDATE, Scope.OWN)
                .grant(Role.EDITOR, Resource.PAGES, Action.MANAGE, Scope.ALL)
                .build();

            assertThat(mixed.scopeFor(Role.EDITOR, Resource.PAGES, Action.UPDATE)).contains(Scope.ALL);
        }

        @Test
        @DisplayName("MANAGE grant should cover every action")
        void manageGrant_shouldCoverAllActions() {
            CapabilityMatrix manage = CapabilityMatrix.builder()
                .grant(Role.EDITOR, Resource.MEDIA, Action.MANAGE, Scope.OWN)
                .build();

            for (Action action : Action.values()) {
                assertThat(manage.scopeFor(Role.EDITOR, Resource.MEDIA, action)).contains(Scope.OWN);
            }
        }

        @Test
        @DisplayName("resourcesFor should list resources in declaration order")
        void resourcesFor_shouldListGrantedResources() {
            assertThat(matrix.resourcesFor(Role.VIEWER)).containsExactly(
                Resource.PRODUCTS, Resource.CATEGORIES, Resource.PAGES,
                Resource.MEDIA, Resource.ORDERS, Resource.PROFILE);
        }

        @Test
        @DisplayName("grantsFor should be unmodifiable")
        void grantsFor_shouldBeUnmodifiable() {
            assertThatThrownBy(() -> matrix.grantsFor(Role.VIEWER)
                .add(CapabilityGrant.of(Resource.USERS, Action.MANAGE, Scope.ALL)))
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("grantsFor should return empty for null role")
        void grantsFor_shouldHandleNullRole() {
            assertThat(matrix.grantsFor(null)).isEmpty();
            assertThat(matrix.scopeFor(null, Resource.PRODUCTS, Action.READ)).isEmpty();
        }
    }

    @Test
    @DisplayName("grant string should combine resource, action and scope codes")
    void toGrantString_shouldUseCodes() {
        assertThat(CapabilityGrant.of(Resource.PRODUCTS, Action.READ, Scope.ALL).toGrantString())
            .isEqualTo("products:read:all");
    }
}
