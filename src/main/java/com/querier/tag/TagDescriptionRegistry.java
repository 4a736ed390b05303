package com.querier.tag;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only registry of which tags carry an enum dictionary, per database and table.
 * Loaded once at startup from {@code tag-descriptions.yaml}.
 */
public class TagDescriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(TagDescriptionRegistry.class);

    static final String ANY_TABLE = "*";

    private final Map<String, String> enumFiles;
    private final Set<String> stringEnums;

    public TagDescriptionRegistry(Map<String, String> enumFiles, Set<String> stringEnums) {
        this.enumFiles = new HashMap<>(enumFiles);
        this.stringEnums = new HashSet<>(stringEnums);
    }

    /**
     * Parse a tag description file
     *
     * @param input YAML stream, closed by the caller
     * @throws IOException if the YAML cannot be parsed
     */
    public static TagDescriptionRegistry load(InputStream input) throws IOException {
        TagDescriptionFile file = new YAMLMapper().readValue(input, TagDescriptionFile.class);
        Map<String, String> enumFiles = new HashMap<>();
        for (TagDescriptionFile.TableDescription table : file.getTables()) {
            if (table.getDb() == null || table.getTable() == null) {
                throw new IOException("tag description entry needs both db and table");
            }
            table.getEnumTags().forEach((tag, dictionary) ->
                    enumFiles.put(key(table.getDb(), table.getTable(), tag), dictionary));
        }
        log.info("Loaded {} enum tag descriptions, {} string-keyed dictionaries",
                enumFiles.size(), file.getStringEnums().size());
        return new TagDescriptionRegistry(enumFiles, new HashSet<>(file.getStringEnums()));
    }

    /**
     * Dictionary behind a tag, table entries first, then database-wide ones
     */
    public Optional<EnumDictionary> getEnumDictionary(String db, String table, String tagName) {
        String dictionary = enumFiles.get(key(db, table, tagName));
        if (dictionary == null) {
            dictionary = enumFiles.get(key(db, ANY_TABLE, tagName));
        }
        if (dictionary == null) {
            return Optional.empty();
        }
        return Optional.of(new EnumDictionary(dictionary, !stringEnums.contains(dictionary)));
    }

    private static String key(String db, String table, String tagName) {
        return db + "." + table + "." + tagName;
    }
}
