package com.querier.query;

import com.querier.prometheus.TargetLabelFilterResolver;
import com.querier.query.filter.Having;
import com.querier.query.filter.TimeWindow;
import com.querier.query.filter.Where;
import com.querier.query.filter.WithClause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Assembles ClickHouse SQL for a parsed statement
 *
 * Filters are compiled with a fresh compilation context per statement;
 * target-label filters deferred along the way are resolved in one batch
 * before the text is rendered.
 */
@Component
public class ClickHouseStatementAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ClickHouseStatementAssembler.class);

    private final WhereCompiler whereCompiler;
    private final TargetLabelFilterResolver targetLabelFilterResolver;

    public ClickHouseStatementAssembler(WhereCompiler whereCompiler,
                                        TargetLabelFilterResolver targetLabelFilterResolver) {
        this.whereCompiler = whereCompiler;
        this.targetLabelFilterResolver = targetLabelFilterResolver;
    }

    /**
     * Compile QueryContext to ClickHouse SQL
     *
     * @throws FilterCompilationException if any filter fails to compile; no partial SQL is returned
     */
    public CompiledStatement assemble(QueryContext query) {
        CompilationContext context = new CompilationContext(query.getDb(), query.getTable(),
                query.getAliasMap(), query.isRemoteRead());
        TimeWindow timeWindow = new TimeWindow();
        Where where = new Where(timeWindow);
        Having having = new Having(timeWindow);

        if (query.getWhereExpression() != null) {
            whereCompiler.addWhere(query.getWhereExpression(), where, context);
        }
        if (query.getHavingExpression() != null) {
            whereCompiler.addHaving(query.getHavingExpression(), having, context);
        }
        targetLabelFilterResolver.resolve(context.getTargetLabelFilters());

        List<WithClause> withs = new ArrayList<>(where.getWiths());
        for (WithClause with : having.getWiths()) {
            if (!withs.contains(with)) {
                withs.add(with);
            }
        }

        StringBuilder sql = new StringBuilder();

        // WITH clause
        if (!withs.isEmpty()) {
            sql.append("WITH ");
            sql.append(withs.stream().map(WithClause::toSql).collect(Collectors.joining(", ")));
            sql.append(" ");
        }

        // SELECT clause
        sql.append("SELECT ");
        if (query.getSelectFields().isEmpty()) {
            sql.append("*");
        } else {
            sql.append(String.join(", ", query.getSelectFields()));
        }

        // FROM clause
        sql.append(" FROM ").append(query.getDb()).append(".").append(query.getTable());

        // WHERE clause
        where.toClause().ifPresent(clause -> sql.append(" ").append(clause));

        // GROUP BY clause
        if (!query.getGroupByFields().isEmpty()) {
            sql.append(" GROUP BY ");
            sql.append(String.join(", ", query.getGroupByFields()));
        }

        // HAVING clause
        having.toClause().ifPresent(clause -> sql.append(" ").append(clause));

        // LIMIT clause
        if (query.getLimit() > 0) {
            sql.append(" LIMIT ").append(query.getLimit());
        }

        logger.debug("Assembled statement for {}.{} with {}: {}", query.getDb(), query.getTable(), timeWindow, sql);
        return new CompiledStatement(sql.toString(), timeWindow, withs);
    }
}
