package org.manuscript.benchmark.domain;

/**
 * Synthetic plugin sources of configurable size.
 */
public final class SamplePlugins {

    private static final String METHOD = String.join("\n",
            "    Process%d \"(score) {",
            "        count = 0;",
            "        for each Staff staff in score {",
            "            for each NoteRest nr in staff {",
            "                if (nr.NoteCount > 0 and nr.Duration >= Crotchet) {",
            "                    count = count + 1;",
            "                    Trace('note ' & nr.Pitch & ' at ' & nr.Position);",
            "                } else {",
            "                    total = count / 2;",
            "                }",
            "            }",
            "        }",
            "        switch (count) {",
            "            case (0) { return False; }",
            "            default { Trace(Chr(count)); }",
            "        }",
            "        return count;",
            "    }\"");

    private SamplePlugins() {
    }

    /**
     * A plugin with an {@code Initialize} method, one variable and {@code methods}
     * processing methods.
     */
    public static String plugin(int methods) {
        StringBuilder source = new StringBuilder("{\n");
        source.append("    Initialize \"() { AddToPluginsMenu('Benchmark', 'Run'); }\"\n");
        source.append("    Threshold \"60\"\n");
        for (int i = 0; i < methods; i++) {
            source.append('\n').append(String.format(METHOD, i)).append('\n');
        }
        return source.append("}\n").toString();
    }

    /**
     * The same plugin squeezed onto as few lines as possible.
     */
    public static String unformatted(int methods) {
        return plugin(methods).replaceAll("\n\\s+", " ");
    }
}
