package com.querier.tag;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tag taxonomy lookup by (name, database, table, category).
 *
 * Descriptors are registered either for one table or for a whole database
 * ({@code *}); the same tag name may translate differently per table.
 * Enum descriptors are derived from the {@link TagDescriptionRegistry}.
 */
public class TagRegistry {

    private final Map<String, Map<String, TagDescriptor>> tags = new ConcurrentHashMap<>();
    private final Map<String, Map<String, KeyedTagDescriptor>> keyedTags = new ConcurrentHashMap<>();
    private final TagDescriptionRegistry descriptions;

    public TagRegistry(TagDescriptionRegistry descriptions) {
        this.descriptions = descriptions;
    }

    public void register(String db, String table, TagDescriptor descriptor) {
        tags.computeIfAbsent(scope(db, table), k -> new ConcurrentHashMap<>())
                .put(descriptor.getName(), descriptor);
    }

    public void registerKeyed(String db, String table, KeyedTagDescriptor descriptor) {
        keyedTags.computeIfAbsent(scope(db, table), k -> new ConcurrentHashMap<>())
                .put(descriptor.getName(), descriptor);
    }

    public Optional<TagDescriptor> getTag(String name, String db, String table) {
        return lookup(tags, name, db, table);
    }

    /**
     * Keyed descriptor of a family ({@code SUBQUERY}), a free-form tag
     * ({@code PLAIN}) or an enum tag ({@code ENUM})
     */
    public Optional<KeyedTagDescriptor> getKeyedTag(String name, String db, String table, TagCategory category) {
        if (category == TagCategory.ENUM) {
            return enumTag(name, db, table);
        }
        return lookup(keyedTags, name, db, table)
                .filter(descriptor -> descriptor.getCategory() == category);
    }

    public TagDescriptionRegistry getDescriptions() {
        return descriptions;
    }

    private Optional<KeyedTagDescriptor> enumTag(String name, String db, String table) {
        return descriptions.getEnumDictionary(db, table, DeviceRoles.stripSuffix(name))
                .map(dictionary -> enumDescriptor(name, dictionary));
    }

    private static KeyedTagDescriptor enumDescriptor(String column, EnumDictionary dictionary) {
        String membership = dictionary.isIntegerKeyed()
                ? "toUInt64(" + column + ") IN (SELECT value FROM flow_tag.int_enum_map WHERE "
                : column + " IN (SELECT value FROM flow_tag.string_enum_map WHERE ";
        return new KeyedTagDescriptor(column, TagCategory.ENUM,
                (dict, op, value) -> membership + "name " + op + " " + value + " and tag_name='" + dict + "')",
                (dict, op, value) -> membership + op + "(name," + value + ") and tag_name='" + dict + "')");
    }

    private static <T> Optional<T> lookup(Map<String, Map<String, T>> source, String name, String db, String table) {
        Map<String, T> tableTags = source.get(scope(db, table));
        if (tableTags != null && tableTags.containsKey(name)) {
            return Optional.of(tableTags.get(name));
        }
        Map<String, T> dbTags = source.get(scope(db, TagDescriptionRegistry.ANY_TABLE));
        if (dbTags != null) {
            return Optional.ofNullable(dbTags.get(name));
        }
        return Optional.empty();
    }

    private static String scope(String db, String table) {
        return db + "." + table;
    }
}
