package com.querier.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A boolean tag function used directly as a predicate, e.g. {@code exist(chost_0)}
 */
public class TagFunctionExpression implements Expression {
    private final String name;
    private final List<String> args;

    public TagFunctionExpression(String name, List<String> args) {
        this.name = name;
        this.args = new ArrayList<>(args);
    }

    public String getName() {
        return name;
    }

    public List<String> getArgs() {
        return Collections.unmodifiableList(args);
    }
}
