package info.isaksson.erland.idlgen.registry;

/** No generator is registered under the requested target id. */
public class UnsupportedTargetException extends IllegalArgumentException {

    private final String target;

    public UnsupportedTargetException(String target) {
        super("Unsupported target: " + target);
        this.target = target;
    }

    public String target() {
        return target;
    }
}
