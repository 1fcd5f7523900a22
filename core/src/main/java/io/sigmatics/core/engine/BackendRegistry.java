package io.sigmatics.core.engine;

import io.sigmatics.core.backend.BackendKind;
import io.sigmatics.core.backend.ClassBackend;
import io.sigmatics.core.backend.SgaBackend;
import io.sigmatics.core.spi.LoweringBackend;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of lowering backends keyed by {@link BackendKind}. Thread-safe: registration and lookup can
 * happen concurrently.
 */
public final class BackendRegistry {

    private final Map<BackendKind, LoweringBackend> backends = new ConcurrentHashMap<>();

    /** A registry holding the built-in class and SGA backends. */
    public static BackendRegistry withDefaults() {
        BackendRegistry registry = new BackendRegistry();
        registry.register(new ClassBackend());
        registry.register(new SgaBackend());
        return registry;
    }

    /**
     * Registers a backend. A backend already registered under the same id is replaced (last write
     * wins).
     *
     * @throws NullPointerException if backend or backend.id() is null
     */
    public void register(LoweringBackend backend) {
        if (backend == null) {
            throw new NullPointerException("backend must not be null");
        }
        BackendKind id = backend.id();
        if (id == null) {
            throw new NullPointerException("backend id must not be null");
        }
        backends.put(id, backend);
    }

    public Optional<LoweringBackend> getBackend(BackendKind id) {
        return Optional.ofNullable(backends.get(id));
    }

    /**
     * @throws IllegalArgumentException if no backend is registered for the id
     */
    public LoweringBackend requireBackend(BackendKind id) {
        return getBackend(id)
                .orElseThrow(() -> new IllegalArgumentException("No backend registered for id: '" + id.id() + "'"));
    }

    public int size() {
        return backends.size();
    }

    public boolean hasBackend(BackendKind id) {
        return backends.containsKey(id);
    }
}
