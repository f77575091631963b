package info.isaksson.erland.idlgen.generator;

/**
 * A generator hook failed. Generation for that backend is abandoned; output already written is
 * not cleaned up.
 */
public class GenerationException extends RuntimeException {

    private final String step;

    public GenerationException(String step, Throwable cause) {
        super("Generation failed in " + step + ": " + cause.getMessage(), cause);
        this.step = step;
    }

    /** The hook call that failed, e.g. {@code generateStruct(Work)}. */
    public String step() {
        return step;
    }
}
