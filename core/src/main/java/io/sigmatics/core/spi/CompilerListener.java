package io.sigmatics.core.spi;

import io.sigmatics.core.backend.BackendKind;
import io.sigmatics.core.model.ComplexityClass;

/**
 * SPI for compilation observability hooks.
 *
 * <p>All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the compiler and logged; they do NOT
 * affect compilation.
 */
public interface CompilerListener {

    /** Called after a model has been compiled and cached. */
    void onModelCompiled(ModelCompiledEvent event);

    /** Called when a cached artifact is returned instead of compiling. */
    void onCacheHit(CacheHitEvent event);

    /** Called when compilation fails at any stage. */
    void onModelRejected(ModelRejectedEvent event);

    // --- Event records ---

    record ModelCompiledEvent(
            String modelName,
            String cacheKey,
            ComplexityClass complexity,
            BackendKind backend,
            int opCount,
            boolean folded,
            long durationMicros) {}

    record CacheHitEvent(String modelName, String cacheKey) {}

    record ModelRejectedEvent(String modelName, String errorCode, String errorDetail) {}
}
