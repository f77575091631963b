package info.isaksson.erland.idlgen.generator;

/** Lifecycle of one generation run. */
public enum GeneratorState {
    CONSTRUCTED,
    /** {@code initGenerator} returned. */
    INITIALIZED,
    /** Declaration hooks are being dispatched. */
    GENERATING,
    /** {@code closeGenerator} returned; the run is complete. */
    CLOSED,
    /** A hook threw; remaining steps were skipped. */
    FAILED
}
