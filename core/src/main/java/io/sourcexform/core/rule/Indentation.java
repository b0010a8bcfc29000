package io.sourcexform.core.rule;

import java.util.ArrayList;
import java.util.List;

/** Leading-whitespace helpers. Rendered lines take the indentation of the line they replace. */
final class Indentation {

    private Indentation() {}

    static String of(String text) {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(0, i);
    }

    /** Prefixes every non-blank line with {@code indent}; blank lines become empty. */
    static List<String> apply(String indent, List<String> lines) {
        List<String> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            out.add(line.isBlank() ? "" : indent + line);
        }
        return out;
    }
}
