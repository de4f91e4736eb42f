package com.atfengine.document;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public record Surface(
        String name,
        String label,
        String modifier,
        List<Column> columns,
        List<Line.StateLine> states
) {
    private static final Map<String, String> LABELS = Map.ofEntries(
        Map.entry("obverse", "Obverse"),
        Map.entry("reverse", "Reverse"),
        Map.entry("left", "Left Edge"),
        Map.entry("right", "Right Edge"),
        Map.entry("top", "Top"),
        Map.entry("bottom", "Bottom"),
        Map.entry("edge", "Edge"),
        Map.entry("face", "Face"),
        Map.entry("seal", "Seal"),
        Map.entry("left_edge", "Left Edge"),
        Map.entry("right_edge", "Right Edge"),
        Map.entry("top_edge", "Top Edge"),
        Map.entry("bottom_edge", "Bottom Edge")
    );

    public Surface {
        columns = columns == null ? List.of() : List.copyOf(columns);
        states = states == null ? List.of() : List.copyOf(states);
    }

    /**
     * 生成表面的展示标签，带修饰符时追加在名称之后，例如 "Surface a1"。
     */
    public static String labelFor(String name, String modifier) {
        String label = LABELS.getOrDefault(name, titleCase(name));
        if (modifier != null && !modifier.isEmpty()) {
            label += " " + modifier;
        }
        return label;
    }

    private static String titleCase(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(name.length());
        for (String part : name.replace('_', ' ').split(" ")) {
            if (part.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(part.substring(0, 1).toUpperCase(Locale.ROOT))
                .append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return builder.toString();
    }
}
