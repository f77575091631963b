package info.isaksson.erland.idlgen.core;

import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.generator.AbstractGenerator;
import info.isaksson.erland.idlgen.generator.Generator;
import info.isaksson.erland.idlgen.registry.GeneratorRegistry;
import info.isaksson.erland.idlgen.registry.TargetSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Programmatic driver: runs one or more targets over a program.
 *
 * <p>CLI and other front ends should use this class instead of driving generators directly.
 * Every (program, target) pair gets a fresh generator instance.</p>
 */
public final class IdlGenService {

    private static final Logger LOG = LoggerFactory.getLogger(IdlGenService.class);

    private final GeneratorRegistry registry;

    public IdlGenService(GeneratorRegistry registry) {
        if (registry == null) throw new IllegalArgumentException("registry must not be null");
        this.registry = registry;
    }

    public GeneratorRegistry registry() {
        return registry;
    }

    /**
     * Generate {@code program} for each target, in the given order.
     *
     * <p>All targets and their options are checked before anything is generated. With
     * {@code options.recurse}, included programs are generated first (depth-first, each program
     * once, identified by name).</p>
     *
     * @throws info.isaksson.erland.idlgen.registry.UnsupportedTargetException for an unknown target
     * @throws IllegalArgumentException for options a backend does not accept
     * @throws info.isaksson.erland.idlgen.generator.GenerationException      when a backend fails
     */
    public IdlGenResult generate(IdlProgram program, List<TargetSpec> targets, IdlGenOptions options) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        if (targets == null || targets.isEmpty()) throw new IllegalArgumentException("at least one target is required");
        if (options == null) options = new IdlGenOptions();

        IdlProgram root = options.outputRoot == null ? program : program.withOutPath(options.outputRoot);

        // Constructing a backend parses and checks its options; nothing is written yet.
        for (TargetSpec t : targets) {
            registry.create(t, root);
        }

        List<IdlProgram> order = new ArrayList<>();
        if (options.recurse) {
            collectIncludesFirst(root, new LinkedHashSet<>(), order);
        } else {
            order.add(root);
        }

        Map<String, List<Path>> files = new LinkedHashMap<>();
        for (TargetSpec t : targets) {
            files.computeIfAbsent(t.id, k -> new ArrayList<>());
        }
        List<String> programs = new ArrayList<>();
        for (IdlProgram p : order) {
            programs.add(p.name);
            for (TargetSpec t : targets) {
                Generator g = registry.create(t, p);
                LOG.info("Generating {} for program '{}' into {}", t, p.name, g.outDir());
                g.generateProgram();
                if (g instanceof AbstractGenerator) {
                    files.get(t.id).addAll(((AbstractGenerator) g).generatedFiles());
                }
            }
        }
        return new IdlGenResult(files, programs);
    }

    private static void collectIncludesFirst(IdlProgram p, Set<String> seen, List<IdlProgram> out) {
        if (!seen.add(p.name)) return;
        for (IdlProgram inc : p.includes) {
            collectIncludesFirst(inc, seen, out);
        }
        out.add(p);
    }
}
