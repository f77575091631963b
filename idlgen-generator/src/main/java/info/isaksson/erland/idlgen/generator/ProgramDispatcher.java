package info.isaksson.erland.idlgen.generator;

import info.isaksson.erland.idlgen.ast.IdlEnum;
import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.ast.IdlService;
import info.isaksson.erland.idlgen.ast.IdlStruct;
import info.isaksson.erland.idlgen.ast.IdlTypedef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Walks a program and invokes the generator hooks, once per generator instance.
 *
 * <p>Order: {@code initGenerator}; typedefs; enums; all consts in one {@code generateConsts} call;
 * structs that are not exceptions; exceptions; services; {@code closeGenerator}. Within each
 * category declarations are visited in source order. Every step runs even when the program is
 * empty. The first failing hook ends the run in {@link GeneratorState#FAILED} without calling
 * the remaining hooks, {@code closeGenerator} included.</p>
 */
public final class ProgramDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramDispatcher.class);

    private final Generator generator;
    private GeneratorState state = GeneratorState.CONSTRUCTED;
    private boolean started;

    public ProgramDispatcher(Generator generator) {
        if (generator == null) throw new IllegalArgumentException("generator is null");
        this.generator = generator;
    }

    public GeneratorState state() {
        return state;
    }

    /**
     * @throws IllegalStateException if this dispatcher already ran (or is running)
     * @throws GenerationException   if a hook fails
     */
    public void run() {
        if (started) {
            throw new IllegalStateException("generateProgram() may only run once per generator instance (state: " + state + ")");
        }
        started = true;

        IdlProgram program = generator.program();
        String backend = generator.getClass().getSimpleName();
        LOG.debug("{}: generating program '{}' into {}", backend, program.name, generator.outDir());

        String step = "initGenerator";
        try {
            generator.initGenerator();
            state = GeneratorState.INITIALIZED;

            state = GeneratorState.GENERATING;
            for (IdlTypedef t : program.typedefs) {
                step = "generateTypedef(" + t.name + ")";
                LOG.debug("{}: {}", backend, step);
                generator.generateTypedef(t);
            }
            for (IdlEnum e : program.enums) {
                step = "generateEnum(" + e.name + ")";
                LOG.debug("{}: {}", backend, step);
                generator.generateEnum(e);
            }
            step = "generateConsts";
            LOG.debug("{}: {} ({} consts)", backend, step, program.consts.size());
            generator.generateConsts(program.consts);
            for (IdlStruct s : program.structs) {
                if (s.isException) continue;
                step = "generateStruct(" + s.name + ")";
                LOG.debug("{}: {}", backend, step);
                generator.generateStruct(s);
            }
            for (IdlStruct s : program.structs) {
                if (!s.isException) continue;
                step = "generateXception(" + s.name + ")";
                LOG.debug("{}: {}", backend, step);
                generator.generateXception(s);
            }
            for (IdlService s : program.services) {
                step = "generateService(" + s.name + ")";
                LOG.debug("{}: {}", backend, step);
                generator.generateService(s);
            }

            step = "closeGenerator";
            generator.closeGenerator();
            state = GeneratorState.CLOSED;
        } catch (IOException | RuntimeException e) {
            state = GeneratorState.FAILED;
            LOG.debug("{}: aborted in {}", backend, step, e);
            throw new GenerationException(step, e);
        }
    }
}
