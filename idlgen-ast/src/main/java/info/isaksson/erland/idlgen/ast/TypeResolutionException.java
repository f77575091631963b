package info.isaksson.erland.idlgen.ast;

/**
 * A type reference could not be followed: a typedef cycle, or a name with no declaration.
 */
public class TypeResolutionException extends RuntimeException {

    public TypeResolutionException(String message) {
        super(message);
    }
}
