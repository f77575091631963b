package info.isaksson.erland.idlgen.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Files written by a generation run, per target id in the order targets ran. */
public final class IdlGenResult {

    /** Target id to written files (across every generated program). */
    public final Map<String, List<Path>> filesByTarget;

    /** Names of the programs that were generated, in generation order. */
    public final List<String> programs;

    IdlGenResult(Map<String, List<Path>> filesByTarget, List<String> programs) {
        Map<String, List<Path>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Path>> e : filesByTarget.entrySet()) {
            copy.put(e.getKey(), List.copyOf(e.getValue()));
        }
        this.filesByTarget = Collections.unmodifiableMap(copy);
        this.programs = List.copyOf(programs);
    }

    /** Every written file, in write order per target. */
    public List<Path> allFiles() {
        List<Path> out = new ArrayList<>();
        for (List<Path> files : filesByTarget.values()) {
            out.addAll(files);
        }
        return out;
    }
}
