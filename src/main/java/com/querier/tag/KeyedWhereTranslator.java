package com.querier.tag;

/**
 * Predicate template of a keyed tag: a family member such as
 * {@code k8s.label.<key>} or an enum tag keyed by its dictionary name
 */
@FunctionalInterface
public interface KeyedWhereTranslator {

    String translate(String key, String operator, String value);
}
