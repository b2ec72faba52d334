package com.warden.core.policy;

import com.warden.core.model.Policy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.warden.core.policy.TestPolicies.definition;
import static com.warden.core.policy.TestPolicies.registryOf;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PolicyRegistryTest {

    @Nested
    @DisplayName("successful load")
    class LoadTests {

        @Test
        @DisplayName("keeps definitions in source order")
        void keepsOrder() {
            PolicyRegistry registry = registryOf(
                    definition("POL_002_b", "deny", Map.of("always", true)),
                    definition("POL_001_a", "allow", Map.of("always", true)));

            List<Policy> policies = registry.load();

            assertEquals(List.of("POL_002_b", "POL_001_a"), policies.stream().map(Policy::id).toList());
            assertTrue(registry.isLoaded());
            assertEquals(2, registry.size());
        }

        @Test
        @DisplayName("reads the source only once")
        void loadOnce() {
            AtomicInteger reads = new AtomicInteger();
            PolicyRegistry registry = new PolicyRegistry(() -> {
                reads.incrementAndGet();
                return List.of(definition("POL_001_a", "deny", Map.of("always", true)));
            });

            List<Policy> first = registry.load();
            List<Policy> second = registry.load();
            registry.getAll();
            registry.getById("POL_001_a");

            assertEquals(1, reads.get());
            assertSame(first, second);
        }

        @Test
        @DisplayName("getAll returns a copy the caller may change freely")
        void getAllIsDefensive() {
            PolicyRegistry registry = registryOf(definition("POL_001_a", "deny", Map.of("always", true)));

            List<Policy> copy = registry.getAll();
            copy.clear();

            assertEquals(1, registry.getAll().size());
        }

        @Test
        @DisplayName("the loaded list itself is unmodifiable")
        void loadedListUnmodifiable() {
            PolicyRegistry registry = registryOf(definition("POL_001_a", "deny", Map.of("always", true)));

            assertThrows(UnsupportedOperationException.class, () -> registry.load().clear());
        }

        @Test
        @DisplayName("getById finds loaded policies and reports absence")
        void getById() {
            PolicyRegistry registry = registryOf(definition("POL_001_a", "deny", Map.of("always", true)));

            assertTrue(registry.getById("POL_001_a").isPresent());
            assertTrue(registry.getById("POL_999_missing").isEmpty());
        }

        @Test
        @DisplayName("getAll triggers the load when nothing has been loaded yet")
        void lazyLoad() {
            PolicyRegistry registry = registryOf(definition("POL_001_a", "deny", Map.of("always", true)));

            assertFalse(registry.isLoaded());
            assertEquals(1, registry.getAll().size());
            assertTrue(registry.isLoaded());
        }
    }

    @Nested
    @DisplayName("failed load")
    class FailureTests {

        @Test
        @DisplayName("duplicate ids abort the load")
        void duplicateIds() {
            PolicyRegistry registry = registryOf(
                    definition("POL_001_a", "deny", Map.of("always", true)),
                    definition("POL_001_a", "allow", Map.of("action_type", "file.read")));

            var ex = assertThrows(PolicyValidationException.class, registry::load);
            assertEquals("POL_001_a", ex.getPolicyId());
            assertFalse(registry.isLoaded());
        }

        @Test
        @DisplayName("one malformed definition leaves no policy visible")
        void malformedDefinitionIsAtomic() {
            PolicyRegistry registry = registryOf(
                    definition("POL_001_a", "deny", Map.of("always", true)),
                    definition("POL_002_b", "maybe", Map.of("always", true)),
                    definition("POL_003_c", "allow", Map.of("always", true)));

            assertThrows(PolicyValidationException.class, registry::load);
            assertFalse(registry.isLoaded());
            assertThrows(PolicyRegistryException.class, registry::getAll);
            assertThrows(PolicyRegistryException.class, () -> registry.getById("POL_001_a"));
        }

        @Test
        @DisplayName("an empty source is fatal")
        void emptySource() {
            PolicyRegistry registry = new PolicyRegistry(List::of);

            assertThrows(PolicyRegistryException.class, registry::load);
        }

        @Test
        @DisplayName("a source that cannot be read is fatal")
        void unreadableSource() {
            PolicyRegistry registry = new PolicyRegistry(() -> {
                throw new IllegalStateException("disk gone");
            });

            var ex = assertThrows(PolicyRegistryException.class, registry::load);
            assertInstanceOf(IllegalStateException.class, ex.getCause());
        }

        @Test
        @DisplayName("validation failures are registry failures")
        void validationIsRegistryFailure() {
            PolicyRegistry registry = registryOf(definition("POL_001_a", "nope", Map.of("always", true)));

            assertThrows(PolicyRegistryException.class, registry::load);
        }

        @Test
        @DisplayName("a policy rejected by its constructor keeps the rejection as cause")
        void constructorRejectionKeepsCause() {
            var parser = mock(PolicyDefinitionParser.class);
            var rejection = new IllegalArgumentException("Policy ID must start with 'POL_': RULE_1");
            when(parser.parse(any())).thenThrow(rejection);
            PolicyRegistry registry = new PolicyRegistry(
                    TestPolicies.sourceOf(definition("POL_001_a", "deny", Map.of("always", true))), parser);

            var ex = assertThrows(PolicyValidationException.class, registry::load);

            assertSame(rejection, ex.getCause());
            assertTrue(ex.getMessage().contains("RULE_1"));
            assertFalse(registry.isLoaded());
        }
    }
}
