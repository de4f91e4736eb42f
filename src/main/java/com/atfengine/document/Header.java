package com.atfengine.document;

public record Header(
        String catalogId,
        String title,
        String language,
        String objectType
) {
}
