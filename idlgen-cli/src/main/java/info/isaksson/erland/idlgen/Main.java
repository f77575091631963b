package info.isaksson.erland.idlgen;

import info.isaksson.erland.idlgen.ast.IdlJson;
import info.isaksson.erland.idlgen.ast.IdlProgram;
import info.isaksson.erland.idlgen.ast.TypeResolutionException;
import info.isaksson.erland.idlgen.backend.BuiltinGenerators;
import info.isaksson.erland.idlgen.core.IdlGenOptions;
import info.isaksson.erland.idlgen.core.IdlGenResult;
import info.isaksson.erland.idlgen.core.IdlGenService;
import info.isaksson.erland.idlgen.generator.GenerationException;
import info.isaksson.erland.idlgen.registry.GeneratorDescriptor;
import info.isaksson.erland.idlgen.registry.GeneratorRegistry;
import info.isaksson.erland.idlgen.registry.TargetSpec;
import info.isaksson.erland.idlgen.registry.UnsupportedTargetException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI entrypoint: reads a program AST (JSON) and runs the requested generators over it.
 *
 * <p>Exit codes: 0 success, 1 usage error or unsupported target, 2 I/O or generation failure.</p>
 */
public final class Main {

    private static final GeneratorRegistry REGISTRY = BuiltinGenerators.registry();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.list) {
            printTargets();
            return 0;
        }

        if (parsed.ast == null) {
            System.err.println("Error: --ast is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }
        if (parsed.targets.isEmpty()) {
            System.err.println("Error: at least one --gen <target> is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final List<TargetSpec> targets = new ArrayList<>();
        try {
            for (String t : parsed.targets) {
                TargetSpec spec = TargetSpec.parse(t);
                REGISTRY.descriptor(spec.id);
                targets.add(spec);
            }
        } catch (UnsupportedTargetException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println("Use --list to show the available targets.");
            return 1;
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            return 1;
        }

        final Path astPath = Paths.get(parsed.ast).toAbsolutePath().normalize();
        if (!Files.exists(astPath) || Files.isDirectory(astPath)) {
            System.err.println("Error: --ast must point to an existing AST JSON file: " + astPath);
            return 1;
        }

        final IdlProgram program;
        try {
            program = IdlJson.read(astPath);
        } catch (IOException e) {
            System.err.println("Error: could not read AST JSON: " + astPath);
            System.err.println(e.getMessage());
            return 2;
        }

        final Path outRoot = Paths.get(parsed.out == null ? "." : parsed.out).toAbsolutePath().normalize();
        try {
            Files.createDirectories(outRoot);
        } catch (IOException e) {
            System.err.println("Error: could not create output directory: " + outRoot);
            System.err.println(e.getMessage());
            return 2;
        }

        IdlGenOptions options = new IdlGenOptions();
        options.outputRoot = outRoot.toString();
        options.recurse = parsed.recurse;

        final IdlGenResult result;
        try {
            result = new IdlGenService(REGISTRY).generate(program, targets, options);
        } catch (GenerationException | TypeResolutionException ex) {
            System.err.println("Error: generation failed.");
            System.err.println(ex.getMessage());
            return 2;
        } catch (IllegalArgumentException ex) {
            // bad generator options are rejected when the backend is created
            System.err.println("Error: " + ex.getMessage());
            return 1;
        }

        StringBuilder summary = new StringBuilder("idlgen\n");
        summary.append("- AST: ").append(astPath).append("\n");
        summary.append("- Output: ").append(outRoot).append("\n");
        summary.append("- Programs: ").append(String.join(", ", result.programs)).append("\n");
        for (Map.Entry<String, List<Path>> e : result.filesByTarget.entrySet()) {
            summary.append("- ").append(e.getKey()).append(": ").append(e.getValue().size()).append(" file(s)\n");
        }
        System.out.print(summary);
        return 0;
    }

    private static void printTargets() {
        System.out.println("Available targets:");
        for (GeneratorDescriptor d : REGISTRY.descriptors()) {
            System.out.println(String.format("  %-10s %s - %s", d.id, d.displayName, d.description));
        }
    }

    static final class CliArgs {
        boolean help = false;
        boolean list = false;
        String ast;
        String out;
        boolean recurse = false;
        final List<String> targets = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --gen=target
                if (a.startsWith("--gen=")) {
                    out.targets.add(a.substring("--gen=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--list":
                        out.list = true;
                        break;
                    case "--ast":
                        out.ast = requireValue(args, ++i, "--ast");
                        break;
                    case "--out":
                        out.out = requireValue(args, ++i, "--out");
                        break;
                    case "--gen":
                        out.targets.add(requireValue(args, ++i, "--gen"));
                        break;
                    case "-r":
                    case "--recurse":
                        out.recurse = true;
                        break;
                    default:
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --ast
                        if (out.ast == null) {
                            out.ast = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static void printHelp() {
            System.out.println(
                    "idlgen\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar idlgen.jar --ast <program.json> --gen <target[:options]> [--gen ...] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --ast <file>           Program AST as JSON (required)\n" +
                    "  --gen <target>         Generator to run, optionally with options after ':'\n" +
                    "                         (e.g. java:beans). Repeatable. Also supports --gen=<target>.\n" +
                    "  --out <dir>            Output root; each generator writes to <dir>/gen-<target>/\n" +
                    "                         (default: .)\n" +
                    "  -r, --recurse          Also generate included programs\n" +
                    "  --list                 List the available targets\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar idlgen-cli/target/idlgen.jar --ast samples/tutorial/tutorial.json --gen java --out out\n" +
                    "  java -jar idlgen-cli/target/idlgen.jar samples/tutorial/tutorial.json --gen json:compact --gen markdown -r\n"
            );
        }
    }
}
