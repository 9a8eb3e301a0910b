package com.gt.recall.model;

import com.gt.recall.exception.InvalidArgumentException;

import java.time.Instant;
import java.util.Set;

public record ReviewItem(String id,
                         String contentRef,
                         Instant createdAt,
                         Set<String> tags) {

    public ReviewItem {
        if (id == null || createdAt == null) {
            throw new InvalidArgumentException("Review item requires an id and a creation time");
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
