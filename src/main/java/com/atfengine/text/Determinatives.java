package com.atfengine.text;

import java.util.Map;

public final class Determinatives {

    public static final String DIVINE = "divine";
    public static final String PLACE = "place";

    private static final Map<String, Determinative> KNOWN = Map.ofEntries(
        Map.entry("d", new Determinative(DIVINE, "divine name", "ᵈ")),
        Map.entry("f", new Determinative("female", "female name", "ᶠ")),
        Map.entry("m", new Determinative("male", "male name", "ᵐ")),
        Map.entry("ki", new Determinative(PLACE, "place name", "ᵏⁱ")),
        Map.entry("disz", new Determinative("count", "count marker", "")),
        Map.entry("gesz", new Determinative("wood", "wooden object", "ᵍᵉˢᶻ")),
        Map.entry("gi", new Determinative("reed", "reed object", "ᵍⁱ")),
        Map.entry("kusz", new Determinative("leather", "leather object", "ᵏᵘˢᶻ")),
        Map.entry("tug2", new Determinative("cloth", "textile", "ᵗᵘᵍ")),
        Map.entry("urud", new Determinative("copper", "copper/bronze", "ᵘʳᵘᵈ")),
        Map.entry("na4", new Determinative("stone", "stone object", "ⁿᵃ⁴")),
        Map.entry("id2", new Determinative("water", "river/canal", "ⁱᵈ")),
        Map.entry("u2", new Determinative("plant", "plant", "ᵘ²")),
        Map.entry("iri", new Determinative("city", "city", "ⁱʳⁱ")),
        Map.entry("kur", new Determinative("land", "land/mountain", "ᵏᵘʳ"))
    );

    private Determinatives() {
    }

    /**
     * 解析限定符代码，未知代码不会失败而是返回 other 描述。
     */
    public static Determinative resolve(String code) {
        if (isKnown(code)) {
            return KNOWN.get(code);
        }
        return Determinative.unknown(code == null ? "" : code);
    }

    public static boolean isKnown(String code) {
        return code != null && KNOWN.containsKey(code);
    }
}
