package com.querier.tag;

import com.querier.query.CompilationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves tag references against the taxonomy.
 *
 * Lookup order: the trimmed, back-quote-stripped name as written, then the
 * canonical tag behind an {@code AS} alias. A miss is not an error; callers
 * try the virtual families and finally pass the tag through as a raw column.
 */
@Component
public class TagResolver {

    private static final Logger logger = LoggerFactory.getLogger(TagResolver.class);

    private final TagRegistry registry;

    public TagResolver(TagRegistry registry) {
        this.registry = registry;
    }

    public ResolvedTag resolve(String tag, CompilationContext context) {
        String name = stripTagName(tag);
        Optional<TagDescriptor> direct = registry.getTag(name, context.getDb(), context.getTable());
        if (direct.isPresent()) {
            return new ResolvedTag(tag, name, direct.get());
        }
        String aliased = context.resolveAlias(tag);
        if (aliased == null && !name.equals(tag)) {
            aliased = context.resolveAlias(name);
        }
        if (aliased != null) {
            String canonical = stripTagName(aliased);
            logger.debug("Tag {} is an alias of {}", tag, canonical);
            return new ResolvedTag(tag, canonical,
                    registry.getTag(canonical, context.getDb(), context.getTable()).orElse(null));
        }
        return new ResolvedTag(tag, name, null);
    }

    /**
     * Remove surrounding back quotes and whitespace
     */
    public static String stripTagName(String tag) {
        String name = tag.trim();
        while (name.startsWith("`")) {
            name = name.substring(1);
        }
        while (name.endsWith("`")) {
            name = name.substring(0, name.length() - 1);
        }
        return name.trim();
    }
}
