package com.scout.data;

public record ConfluenceDoc(
        String title,
        String content,
        String updated
) {
}
