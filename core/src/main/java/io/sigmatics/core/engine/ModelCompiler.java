package io.sigmatics.core.engine;

import io.sigmatics.core.backend.BackendKind;
import io.sigmatics.core.backend.BackendPlan;
import io.sigmatics.core.backend.ExecutionResult;
import io.sigmatics.core.compiler.ComplexityAnalyzer;
import io.sigmatics.core.compiler.RewriteEngine;
import io.sigmatics.core.error.InvalidDescriptorException;
import io.sigmatics.core.error.SigmaticsException;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.model.BackendPreference;
import io.sigmatics.core.model.ComplexityClass;
import io.sigmatics.core.model.DescriptorValidationMode;
import io.sigmatics.core.model.ModelDescriptor;
import io.sigmatics.core.spec.DescriptorParser;
import io.sigmatics.core.spec.DescriptorValidator;
import io.sigmatics.core.spec.ValidationResult;
import io.sigmatics.core.spi.CompilerListener;
import io.sigmatics.core.spi.LoweringBackend;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles model descriptors into runnable {@link CompiledModel}s.
 *
 * <p>Pipeline: validate the descriptor, derive its cache key and return a cached artifact when one
 * exists; otherwise build the tree from the named recipe, normalize it, classify it, pick a backend,
 * lower, fold C0 models to a constant, cache the artifact and notify the listener.
 *
 * <p>A valid complexity hint on the descriptor replaces the computed class for backend selection.
 * Constant folding only happens when the computed class is C0, since only then is the tree free of
 * runtime inputs.
 *
 * <p>Thread-safe. The only shared mutable state is the {@link ModelCache}.
 */
public final class ModelCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ModelCompiler.class);

    private final BackendRegistry backends;
    private final ModelRecipes recipes;
    private final SchemaRegistry schemas;
    private final ModelCache cache;
    private final CompilerOptions options;
    private final CompilerListener listener;
    private final DescriptorParser parser;

    /** Creates a compiler with the standard recipes, both backends, a private cache and default options. */
    public ModelCompiler() {
        this(new ModelCache());
    }

    public ModelCompiler(ModelCache cache) {
        this(cache, CompilerOptions.DEFAULT);
    }

    public ModelCompiler(ModelCache cache, CompilerOptions options) {
        this(BackendRegistry.withDefaults(), ModelRecipes.standard(), new SchemaRegistry(), cache, options, null);
    }

    /**
     * Creates a compiler with every collaborator supplied.
     *
     * @param listener optional listener for compilation events, may be {@code null}
     */
    public ModelCompiler(
            BackendRegistry backends,
            ModelRecipes recipes,
            SchemaRegistry schemas,
            ModelCache cache,
            CompilerOptions options,
            CompilerListener listener) {
        this.backends = Objects.requireNonNull(backends, "backends must not be null");
        this.recipes = Objects.requireNonNull(recipes, "recipes must not be null");
        this.schemas = Objects.requireNonNull(schemas, "schemas must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.listener = listener;
        this.parser = new DescriptorParser();
    }

    /**
     * Compiles a descriptor, or returns the cached artifact for an identical one.
     *
     * @throws io.sigmatics.core.error.ConstructionException for invalid descriptors or unknown models
     * @throws io.sigmatics.core.error.LoweringException for invalid hints or unsupported backend ops
     */
    public CompiledModel compile(ModelDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        long start = System.nanoTime();
        try {
            ComplexityClass hint = descriptor.complexityHint() == null
                    ? null
                    : ComplexityClass.parseHint(descriptor.complexityHint(), descriptor.name());
            checkDescriptor(descriptor);

            String key = CacheKeys.derive(descriptor, schemas.schemaHash(descriptor.name()), options);
            Optional<CompiledModel> cached = cache.get(key);
            if (cached.isPresent()) {
                LOG.debug("Cache hit: model={}, key={}", descriptor.name(), key);
                notifyCacheHit(descriptor, key);
                return cached.get();
            }

            IrNode ir = RewriteEngine.normalize(recipes.build(descriptor));
            ComplexityClass computed = ComplexityAnalyzer.classify(ir, descriptor.compiled());
            ComplexityClass effective = hint != null ? hint : computed;
            BackendPreference preference =
                    descriptor.preference() != null ? descriptor.preference() : options.defaultPreference();
            BackendKind backendKind = ComplexityAnalyzer.selectBackend(effective, preference);
            LoweringBackend backend = backends.requireBackend(backendKind);

            BackendPlan plan = backend.lower(ir, descriptor.name());
            ExecutionResult constant = options.constantFolding() && computed == ComplexityClass.C0
                    ? backend.execute(plan, Map.of(), descriptor.name())
                    : null;

            CompiledModel model = new CompiledModel(descriptor, key, ir, effective, plan, backend, constant);
            cache.put(key, model);

            long durationMicros = (System.nanoTime() - start) / 1_000;
            LOG.info(
                    "Model compiled: model={}, complexity={}, backend={}, ops={}, folded={}, durationMicros={}",
                    descriptor.qualifiedName(),
                    effective,
                    backendKind.id(),
                    plan.ops().size(),
                    constant != null,
                    durationMicros);
            notifyCompiled(model, durationMicros);
            return model;
        } catch (SigmaticsException e) {
            LOG.warn("Model rejected: model={}, error={}", descriptor.name(), e.getMessage());
            notifyRejected(descriptor.name(), e);
            throw e;
        }
    }

    /**
     * Parses a descriptor file and compiles it.
     *
     * @throws InvalidDescriptorException if the file cannot be read or fails validation
     */
    public CompiledModel compile(Path descriptorFile) {
        return compile(parser.parse(descriptorFile));
    }

    /** Checks runtime inputs against the model's bundled schema, if it has one. */
    public ValidationResult validateRuntime(CompiledModel model, Map<String, ?> params) {
        return schemas.validateParams(model.name(), params);
    }

    public ModelCache cache() {
        return cache;
    }

    public CompilerOptions options() {
        return options;
    }

    public ModelRecipes recipes() {
        return recipes;
    }

    private void checkDescriptor(ModelDescriptor descriptor) {
        ValidationResult result = DescriptorValidator.validate(descriptor);
        if (result.valid()) {
            return;
        }
        // an unnamed descriptor is rejected in every mode
        boolean unnamed = descriptor.name() == null || descriptor.name().isBlank();
        if (unnamed || options.validationMode() == DescriptorValidationMode.STRICT) {
            throw new InvalidDescriptorException(
                    "Invalid model descriptor '" + descriptor.name() + "': " + result.errors(),
                    descriptor.name(),
                    null,
                    result.errors());
        }
        LOG.warn("Descriptor validation failed, compiling anyway: model={}, errors={}",
                descriptor.name(), result.errors());
    }

    private void notifyCompiled(CompiledModel model, long durationMicros) {
        if (listener == null) return;
        try {
            listener.onModelCompiled(new CompilerListener.ModelCompiledEvent(
                    model.name(),
                    model.cacheKey(),
                    model.complexity(),
                    model.backend(),
                    model.plan().ops().size(),
                    model.isFolded(),
                    durationMicros));
        } catch (Exception e) {
            LOG.warn("CompilerListener.onModelCompiled failed", e);
        }
    }

    private void notifyCacheHit(ModelDescriptor descriptor, String key) {
        if (listener == null) return;
        try {
            listener.onCacheHit(new CompilerListener.CacheHitEvent(descriptor.name(), key));
        } catch (Exception e) {
            LOG.warn("CompilerListener.onCacheHit failed", e);
        }
    }

    private void notifyRejected(String modelName, SigmaticsException cause) {
        if (listener == null) return;
        try {
            listener.onModelRejected(
                    new CompilerListener.ModelRejectedEvent(modelName, cause.code(), cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("CompilerListener.onModelRejected failed", e);
        }
    }
}
