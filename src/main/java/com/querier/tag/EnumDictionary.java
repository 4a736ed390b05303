package com.querier.tag;

/**
 * Enum dictionary backing a tag: integer-keyed dictionaries live in
 * {@code flow_tag.int_enum_map}, string-keyed ones in {@code flow_tag.string_enum_map}
 */
public class EnumDictionary {
    private final String name;
    private final boolean integerKeyed;

    public EnumDictionary(String name, boolean integerKeyed) {
        this.name = name;
        this.integerKeyed = integerKeyed;
    }

    public String getName() {
        return name;
    }

    public boolean isIntegerKeyed() {
        return integerKeyed;
    }

    @Override
    public String toString() {
        return name + (integerKeyed ? "(int)" : "(string)");
    }
}
