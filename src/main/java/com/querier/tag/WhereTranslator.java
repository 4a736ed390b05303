package com.querier.tag;

/**
 * Predicate template of a plain tag, filled with a dialect operator and an
 * encoded value. Templates that need the pair twice repeat it internally.
 */
@FunctionalInterface
public interface WhereTranslator {

    String translate(String operator, String value);
}
