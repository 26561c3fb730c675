package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryNonceStore")
class InMemoryNonceStoreTest {

    private InMemoryNonceStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryNonceStore();
    }

    @Test
    @DisplayName("should not know unregistered keys")
    void shouldNotKnowUnregisteredKeys() {
        assertEquals(OptionalLong.empty(), store.expectedNonce("k1"));
    }

    @Test
    @DisplayName("should advance the expected nonce after each accepted use")
    void shouldAdvanceAfterAcceptedUse() {
        store.register("k1", 42);

        assertTrue(store.accepted("k1", 42));
        assertEquals(OptionalLong.of(43), store.expectedNonce("k1"));
    }

    @Test
    @DisplayName("should refuse to record a nonce twice")
    void shouldRefuseSecondUse() {
        store.register("k1", 42);

        assertTrue(store.accepted("k1", 42));
        assertFalse(store.accepted("k1", 42));
        assertEquals(OptionalLong.of(43), store.expectedNonce("k1"));
    }

    @Test
    @DisplayName("should retire a key at the end of the unsigned range")
    void shouldRetireExhaustedKey() {
        store.register("k1", -1L);

        assertTrue(store.accepted("k1", -1L));
        assertEquals(OptionalLong.empty(), store.expectedNonce("k1"));
    }

    @Test
    @DisplayName("should forget revoked keys")
    void shouldForgetRevokedKeys() {
        store.register("k1", 1);
        store.revoke("k1");

        assertFalse(store.accepted("k1", 1));
        assertEquals(OptionalLong.empty(), store.expectedNonce("k1"));
    }
}
