package com.querier.tag;

import java.util.Optional;

/**
 * Outcome of resolving a tag reference: the name as written, the canonical
 * name after alias substitution, and the descriptor when the taxonomy knows it
 */
public class ResolvedTag {
    private final String originalTag;
    private final String name;
    private final TagDescriptor descriptor;

    public ResolvedTag(String originalTag, String name, TagDescriptor descriptor) {
        this.originalTag = originalTag;
        this.name = name;
        this.descriptor = descriptor;
    }

    public String getOriginalTag() {
        return originalTag;
    }

    public String getName() {
        return name;
    }

    public Optional<TagDescriptor> getDescriptor() {
        return Optional.ofNullable(descriptor);
    }

    public boolean isFound() {
        return descriptor != null;
    }
}
