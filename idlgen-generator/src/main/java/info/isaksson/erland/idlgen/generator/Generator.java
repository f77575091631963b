package info.isaksson.erland.idlgen.generator;

import info.isaksson.erland.idlgen.ast.IdlConst;
import info.isaksson.erland.idlgen.ast.IdlEnum;
import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.ast.IdlService;
import info.isaksson.erland.idlgen.ast.IdlStruct;
import info.isaksson.erland.idlgen.ast.IdlTypedef;
import info.isaksson.erland.idlgen.naming.StringEscaper;

import java.io.IOException;
import java.util.List;

/**
 * Capability set of a target-language backend.
 *
 * <p>{@link #generateTypedef}, {@link #generateEnum}, {@link #generateStruct} and
 * {@link #generateService} must be implemented; every other hook has a default. The hooks are
 * called by {@link ProgramDispatcher} in a fixed order, see {@link #generateProgram()}.
 * Implementations must not modify the program; all file output goes below {@link #outDir()}.</p>
 */
public interface Generator {

    /** The program this instance was created for. */
    IdlProgram program();

    /** Backend-specific output sub-directory name, e.g. {@code gen-java}. */
    String outDirBase();

    /**
     * Generate code for the whole program. Runs once per instance; see {@link ProgramDispatcher}
     * for the call sequence.
     *
     * @throws GenerationException when any hook fails; the run is abandoned
     */
    void generateProgram();

    /** Called once before any declaration hook. */
    default void initGenerator() throws IOException {
    }

    /** Called once after all declaration hooks. */
    default void closeGenerator() throws IOException {
    }

    void generateTypedef(IdlTypedef typedef) throws IOException;

    void generateEnum(IdlEnum enumDecl) throws IOException;

    /**
     * Called once with every const of the program, in declaration order, so a backend can emit
     * them as one block. The default hands each const to {@link #generateConst}.
     */
    default void generateConsts(List<IdlConst> consts) throws IOException {
        for (IdlConst c : consts) {
            generateConst(c);
        }
    }

    default void generateConst(IdlConst constDecl) throws IOException {
    }

    void generateStruct(IdlStruct struct) throws IOException;

    /** Exceptions are structs unless the backend says otherwise. */
    default void generateXception(IdlStruct exception) throws IOException {
        generateStruct(exception);
    }

    void generateService(IdlService service) throws IOException;

    default String programName(IdlProgram p) {
        return p.name;
    }

    default String serviceName(IdlService s) {
        return s.name;
    }

    /**
     * {@code outPath + "/" + outDirBase() + "/"}; a trailing slash on the program's output path is
     * not doubled.
     */
    default String outDir() {
        String root = program().outPath;
        if (root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        return root + "/" + outDirBase() + "/";
    }

    default String escapeString(String in) {
        return StringEscaper.escape(in);
    }
}
