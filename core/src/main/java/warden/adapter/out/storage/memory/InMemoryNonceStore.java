package warden.adapter.out.storage.memory;

import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jboss.logging.Logger;

import warden.core.port.out.NonceStore;

/**
 * In-memory nonce store with strictly increasing nonces.
 *
 * <p>Each registered key expects exactly one nonce at a time. Once a request signed with it is accepted,
 * the expected nonce moves to the next value, so the same signed request cannot be replayed. A key whose
 * nonce would wrap past the unsigned 64-bit maximum is retired.
 *
 * <p>
 * This implementation is intended for development and testing only.
 * Nonces are lost on restart and not shared across instances.
 */
public class InMemoryNonceStore implements NonceStore {

    private static final Logger LOG = Logger.getLogger(InMemoryNonceStore.class);

    private static final long MAX_UNSIGNED = -1L;

    private final ConcurrentMap<String, Long> nonces = new ConcurrentHashMap<>();

    /**
     * Register a key, or reset its expected nonce.
     *
     * @param apiKey       the API key
     * @param initialNonce first nonce the key must sign with (unsigned)
     */
    public void register(String apiKey, long initialNonce) {
        nonces.put(apiKey, initialNonce);
        LOG.debugv("Registered API key with nonce {0}", Long.toUnsignedString(initialNonce));
    }

    public void revoke(String apiKey) {
        nonces.remove(apiKey);
    }

    @Override
    public OptionalLong expectedNonce(String apiKey) {
        Long nonce = nonces.get(apiKey);
        return nonce == null ? OptionalLong.empty() : OptionalLong.of(nonce);
    }

    @Override
    public boolean accepted(String apiKey, long nonce) {
        if (nonce == MAX_UNSIGNED) {
            boolean retired = nonces.remove(apiKey, nonce);
            if (retired) {
                LOG.warn("API key exhausted its nonce range and was retired");
            }
            return retired;
        }
        return nonces.replace(apiKey, nonce, nonce + 1);
    }
}
