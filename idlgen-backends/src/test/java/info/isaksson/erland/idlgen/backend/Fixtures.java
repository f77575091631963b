package info.isaksson.erland.idlgen.backend;

import info.isaksson.erland.idlgen.ast.IdlJson;
import info.isaksson.erland.idlgen.ast.IdlProgram;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/** Loads the bundled tutorial AST. */
public final class Fixtures {

    private Fixtures() {}

    public static IdlProgram tutorial(Path outRoot) throws IOException {
        try (InputStream in = Fixtures.class.getResourceAsStream("/ast/tutorial.json")) {
            if (in == null) throw new IllegalStateException("fixture /ast/tutorial.json missing from test resources");
            IdlProgram p = IdlJson.readFromString(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            return p.withOutPath(outRoot.toString());
        }
    }
}
