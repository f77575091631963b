package info.isaksson.erland.idlgen.registry;

import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.generator.Generator;
import info.isaksson.erland.idlgen.generator.GeneratorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps target ids to generator factories.
 *
 * <p>All registration happens on the {@link Builder}; a built registry is immutable and may be
 * shared between threads and generation runs.</p>
 */
public final class GeneratorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(GeneratorRegistry.class);

    private final Map<String, GeneratorDescriptor> descriptors;

    private GeneratorRegistry(Map<String, GeneratorDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isRegistered(String id) {
        return id != null && descriptors.containsKey(id);
    }

    /** All entries in registration order. */
    public List<GeneratorDescriptor> descriptors() {
        return List.copyOf(descriptors.values());
    }

    /**
     * @throws UnsupportedTargetException if {@code id} is not registered
     */
    public GeneratorDescriptor descriptor(String id) {
        GeneratorDescriptor d = id == null ? null : descriptors.get(id);
        if (d == null) {
            throw new UnsupportedTargetException(id);
        }
        return d;
    }

    /**
     * Create the generator registered as {@code id}, bound to {@code program}.
     *
     * <p>The id is checked before the options are parsed or a factory is called, so an unknown
     * target constructs nothing.</p>
     *
     * @throws UnsupportedTargetException if {@code id} is not registered
     * @throws IllegalArgumentException   if the options are malformed or rejected by the backend
     */
    public Generator create(String id, IdlProgram program, String options) {
        GeneratorDescriptor d = descriptor(id);
        if (program == null) throw new IllegalArgumentException("program must not be null");
        GeneratorOptions parsed = GeneratorOptions.parse(options);
        LOG.debug("Creating generator '{}' for program '{}' (options: '{}')", id, program.name, parsed.raw());
        Generator g = d.factory.create(program, parsed);
        if (g == null) {
            throw new IllegalStateException("Factory for target '" + id + "' returned null");
        }
        return g;
    }

    public Generator create(TargetSpec target, IdlProgram program) {
        if (target == null) throw new IllegalArgumentException("target must not be null");
        return create(target.id, program, target.options);
    }

    public static final class Builder {
        private final Map<String, GeneratorDescriptor> descriptors = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String id, GeneratorFactory factory) {
            return register(id, id, null, factory);
        }

        /**
         * @throws IllegalArgumentException on a blank id, a malformed id or a duplicate
         */
        public Builder register(String id, String displayName, String description, GeneratorFactory factory) {
            if (id == null || id.isBlank()) throw new IllegalArgumentException("generator id must not be blank");
            if (id.contains(":") || id.contains(",") || !id.equals(id.trim())) {
                throw new IllegalArgumentException("Invalid generator id: '" + id + "'");
            }
            if (factory == null) throw new IllegalArgumentException("factory must not be null");
            if (descriptors.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate generator id: " + id);
            }
            descriptors.put(id, new GeneratorDescriptor(id, displayName, description, factory));
            return this;
        }

        public GeneratorRegistry build() {
            return new GeneratorRegistry(descriptors);
        }
    }
}
