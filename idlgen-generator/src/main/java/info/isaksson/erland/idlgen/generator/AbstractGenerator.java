package info.isaksson.erland.idlgen.generator;

import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.ast.IdlType;
import info.isaksson.erland.idlgen.ast.IdlTypeResolver;
import info.isaksson.erland.idlgen.naming.Indenter;
import info.isaksson.erland.idlgen.naming.TempNames;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for backends: binds the program and options, and owns the per-run state
 * (temporary names, indentation, list of written files).
 *
 * <p>None of that state is shared between instances; create one instance per generation run.</p>
 */
public abstract class AbstractGenerator implements Generator {

    protected final IdlProgram program;
    protected final GeneratorOptions options;
    protected final IdlTypeResolver types;

    private final String outDirBase;
    private final TempNames tempNames = new TempNames();
    private final Indenter indenter = new Indenter();
    private final List<Path> generatedFiles = new ArrayList<>();
    private final ProgramDispatcher dispatcher = new ProgramDispatcher(this);
    private String cachedProgramName;

    protected AbstractGenerator(IdlProgram program, GeneratorOptions options, String outDirBase) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        if (outDirBase == null || outDirBase.isBlank()) throw new IllegalArgumentException("outDirBase must not be blank");
        this.program = program;
        this.options = options == null ? GeneratorOptions.empty() : options;
        this.types = new IdlTypeResolver(program);
        this.outDirBase = outDirBase;
    }

    @Override
    public final IdlProgram program() {
        return program;
    }

    @Override
    public final String outDirBase() {
        return outDirBase;
    }

    @Override
    public final void generateProgram() {
        dispatcher.run();
    }

    public GeneratorState state() {
        return dispatcher.state();
    }

    /** Files written so far through {@link #writeFile}, in write order. */
    public List<Path> generatedFiles() {
        return Collections.unmodifiableList(generatedFiles);
    }

    public GeneratorOptions options() {
        return options;
    }

    /** Name of the bound program as formatted by {@link #programName(IdlProgram)}, computed once. */
    protected String programName() {
        if (cachedProgramName == null) {
            cachedProgramName = programName(program);
        }
        return cachedProgramName;
    }

    protected String tmp(String prefix) {
        return tempNames.next(prefix);
    }

    protected void indentUp() {
        indenter.indentUp();
    }

    protected void indentDown() {
        indenter.indentDown();
    }

    protected String indent() {
        return indenter.indent();
    }

    protected IdlType trueType(IdlType type) {
        return types.trueType(type);
    }

    /**
     * Write {@code content} (UTF-8) to {@code relativePath} below {@link #outDir()}, creating
     * directories as needed.
     *
     * @throws IllegalArgumentException if the path resolves outside {@link #outDir()}
     */
    protected Path writeFile(String relativePath, String content) throws IOException {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
        Path root = Paths.get(outDir()).toAbsolutePath().normalize();
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IllegalArgumentException("Path escapes output directory " + root + ": " + relativePath);
        }
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        generatedFiles.add(target);
        return target;
    }
}
