package com.atfengine.legend;

import com.atfengine.document.Document;
import com.atfengine.document.Line;
import com.atfengine.text.Determinatives;
import com.atfengine.text.Word;

import java.util.ArrayList;
import java.util.List;

/**
 * 扫描文档中出现的词元类别，生成展示层图例。
 */
public class LegendSummarizer {

    public static final LegendItem HAS_DEFINITION = new LegendItem("has-definition", "Has definition", "");
    public static final LegendItem NO_DEFINITION = new LegendItem("no-definition", "No definition", "");
    public static final LegendItem DIVINE = new LegendItem("det-divine", "Divine name", "ᵈ");
    public static final LegendItem PLACE = new LegendItem("det-place", "Place name", "ᵏⁱ");
    public static final LegendItem LOGOGRAM = new LegendItem("logogram", "Logogram", "_text_");
    public static final LegendItem DAMAGED = new LegendItem("damaged", "Damaged", "#");
    public static final LegendItem UNCERTAIN = new LegendItem("uncertain", "Uncertain", "?");
    public static final LegendItem BROKEN = new LegendItem("broken", "Broken", "[...]");
    public static final LegendItem TRANSLATION = new LegendItem("translation", "Line translation", "│");

    /**
     * 两条释义占位条目总是输出，其余条目按固定顺序仅在对应特征出现时输出。
     */
    public List<LegendItem> summarize(Document document) {
        List<LegendItem> legend = new ArrayList<>();
        legend.add(HAS_DEFINITION);
        legend.add(NO_DEFINITION);
        if (document == null) {
            return List.copyOf(legend);
        }

        Features features = scan(document);
        if (features.divine) {
            legend.add(DIVINE);
        }
        if (features.place) {
            legend.add(PLACE);
        }
        if (features.logogram) {
            legend.add(LOGOGRAM);
        }
        if (features.damaged) {
            legend.add(DAMAGED);
        }
        if (features.uncertain) {
            legend.add(UNCERTAIN);
        }
        if (features.broken) {
            legend.add(BROKEN);
        }
        if (features.translation) {
            legend.add(TRANSLATION);
        }
        return List.copyOf(legend);
    }

    private Features scan(Document document) {
        Features features = new Features();
        for (Line.ContentLine line : document.contentLines()) {
            if (!line.translations().isEmpty()) {
                features.translation = true;
            }
            for (Word word : line.words()) {
                if (word instanceof Word.Broken) {
                    features.broken = true;
                } else if (word instanceof Word.Logogram) {
                    features.logogram = true;
                } else if (word instanceof Word.DeterminativeWord determinativeWord) {
                    String type = determinativeWord.determinative().type();
                    if (Determinatives.DIVINE.equals(type)) {
                        features.divine = true;
                    } else if (Determinatives.PLACE.equals(type)) {
                        features.place = true;
                    }
                } else if (word instanceof Word.Plain plain) {
                    features.damaged |= plain.damaged();
                    features.uncertain |= plain.uncertain();
                }
            }
        }
        return features;
    }

    private static final class Features {
        private boolean divine;
        private boolean place;
        private boolean logogram;
        private boolean damaged;
        private boolean uncertain;
        private boolean broken;
        private boolean translation;
    }
}
