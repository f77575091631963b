package info.isaksson.erland.idlgen.naming;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders IDL doc strings as comment blocks in generated code.
 */
public final class DocComments {

    private DocComments() {}

    /**
     * Render {@code contents} as a comment block.
     *
     * <p>Leading and trailing blank lines of the doc are dropped. Each remaining line is written as
     * {@code indent + linePrefix + line}; a blank line gets the prefix with trailing whitespace
     * removed. {@code commentStart} and {@code commentEnd} get their own lines when non-empty.
     * Returns the empty string when there is nothing to render.</p>
     */
    public static String render(String indent, String commentStart, String linePrefix, String contents, String commentEnd) {
        if (contents == null || contents.isBlank()) return "";
        List<String> lines = new ArrayList<>(List.of(contents.replace("\r\n", "\n").split("\n", -1)));
        while (!lines.isEmpty() && lines.get(0).isBlank()) lines.remove(0);
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) lines.remove(lines.size() - 1);

        StringBuilder out = new StringBuilder();
        if (commentStart != null && !commentStart.isEmpty()) {
            out.append(indent).append(commentStart).append('\n');
        }
        for (String line : lines) {
            String text = line.stripTrailing();
            if (text.isEmpty()) {
                out.append((indent + linePrefix).stripTrailing()).append('\n');
            } else {
                out.append(indent).append(linePrefix).append(text).append('\n');
            }
        }
        if (commentEnd != null && !commentEnd.isEmpty()) {
            out.append(indent).append(commentEnd).append('\n');
        }
        return out.toString();
    }
}
