package com.querier.query;

import com.querier.query.filter.WithClause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function call appearing on the left side of a filter, e.g. {@code Enum(protocol)}
 * or {@code Avg(byte_tx)}.
 *
 * Functions may depend on auxiliary WITH expressions; those are attached to the
 * final statement, never substituted inline.
 */
public class FunctionExpression {
    private final String name;
    private final List<String> args;
    private final List<WithClause> withs;

    public FunctionExpression(String name, List<String> args) {
        this(name, args, Collections.emptyList());
    }

    public FunctionExpression(String name, List<String> args, List<WithClause> withs) {
        this.name = name;
        this.args = new ArrayList<>(args);
        this.withs = new ArrayList<>(withs);
    }

    public String getName() {
        return name;
    }

    public List<String> getArgs() {
        return Collections.unmodifiableList(args);
    }

    public List<WithClause> getWiths() {
        return Collections.unmodifiableList(withs);
    }

    public String toSql() {
        return name + "(" + String.join(", ", args) + ")";
    }
}
