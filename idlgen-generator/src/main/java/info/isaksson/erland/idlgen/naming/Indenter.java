package info.isaksson.erland.idlgen.naming;

/**
 * Indentation level of the code currently being emitted. One level renders as two spaces.
 */
public final class Indenter {

    private static final String UNIT = "  ";

    private int depth;

    public void indentUp() {
        depth++;
    }

    /**
     * @throws IllegalStateException when the level is already zero (unbalanced up/down calls)
     */
    public void indentDown() {
        if (depth == 0) {
            throw new IllegalStateException("indentation underflow: indentDown() without matching indentUp()");
        }
        depth--;
    }

    public int depth() {
        return depth;
    }

    public String indent() {
        return UNIT.repeat(depth);
    }
}
