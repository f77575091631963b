package info.isaksson.erland.idlgen.registry;

import java.util.Objects;

/** Registry entry: target id, human-readable name, help text and factory. */
public final class GeneratorDescriptor {
    public final String id;
    public final String displayName;
    public final String description;
    public final GeneratorFactory factory;

    public GeneratorDescriptor(String id, String displayName, String description, GeneratorFactory factory) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.displayName = displayName == null ? id : displayName;
        this.description = description == null ? "" : description;
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    @Override public String toString() {
        return id + " (" + displayName + ")";
    }
}
