package com.atfengine.legend;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 图例条目，cssClass 对应展示层的样式类名。
 */
public record LegendItem(
        @JsonProperty("class") String cssClass,
        String label,
        String symbol
) {
}
