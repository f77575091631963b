package info.isaksson.erland.idlgen.registry;

import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.generator.Generator;
import info.isaksson.erland.idlgen.generator.GeneratorOptions;

/** Creates a backend bound to one program. */
@FunctionalInterface
public interface GeneratorFactory {
    Generator create(IdlProgram program, GeneratorOptions options);
}
