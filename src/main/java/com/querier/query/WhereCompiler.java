package com.querier.query;

import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.filter.BinaryExprNode;
import com.querier.query.filter.DescriptorFilterBuilder;
import com.querier.query.filter.EnumFilterBuilder;
import com.querier.query.filter.ExprNode;
import com.querier.query.filter.FilterNode;
import com.querier.query.filter.Having;
import com.querier.query.filter.NotNode;
import com.querier.query.filter.TimeTagExtractor;
import com.querier.query.filter.Where;
import com.querier.query.operator.Operator;
import com.querier.query.operator.OperatorNormalizer;
import com.querier.tag.ResolvedTag;
import com.querier.tag.TagResolver;
import com.querier.tag.family.TagFilterRequest;
import com.querier.tag.family.TagFunctionTranslator;
import com.querier.tag.family.VirtualTagRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Compiles parsed WHERE/HAVING expression trees into ClickHouse predicates.
 *
 * Each comparison goes through the same steps: the reserved {@code time}
 * tag first, then operator normalization, taxonomy lookup (alias included),
 * the virtual tag families, and finally a verbatim pass-through for tags
 * nobody claims. The first failure aborts the whole clause.
 */
@Component
public class WhereCompiler {

    private static final Logger logger = LoggerFactory.getLogger(WhereCompiler.class);

    private final TagResolver tagResolver;
    private final VirtualTagRouter virtualTagRouter;
    private final EnumFilterBuilder enumFilterBuilder;
    private final TagFunctionTranslator tagFunctionTranslator;
    private final FilterMetrics metrics;

    public WhereCompiler(TagResolver tagResolver,
                         VirtualTagRouter virtualTagRouter,
                         EnumFilterBuilder enumFilterBuilder,
                         TagFunctionTranslator tagFunctionTranslator,
                         FilterMetrics metrics) {
        this.tagResolver = tagResolver;
        this.virtualTagRouter = virtualTagRouter;
        this.enumFilterBuilder = enumFilterBuilder;
        this.tagFunctionTranslator = tagFunctionTranslator;
        this.metrics = metrics;
    }

    /**
     * Compile an expression and append it to the WHERE clause
     *
     * @throws FilterCompilationException on the first predicate that cannot be compiled
     */
    public void addWhere(Expression expression, Where where, CompilationContext context) {
        where.addFilter(compileClause(expression, where, context));
    }

    /**
     * Compile an expression and append it to the HAVING clause
     */
    public void addHaving(Expression expression, Having having, CompilationContext context) {
        having.addFilter(compileClause(expression, having, context));
    }

    private FilterNode compileClause(Expression expression, Where where, CompilationContext context) {
        try {
            return compile(expression, where, context);
        } catch (FilterCompilationException e) {
            metrics.recordCompilationFailed();
            logger.debug("Filter compilation failed on {}.{}: {}", context.getDb(), context.getTable(), e.getMessage());
            throw e;
        }
    }

    /**
     * Compile one expression node, recursing through AND/OR/NOT
     */
    public FilterNode compile(Expression expression, Where where, CompilationContext context) {
        if (expression instanceof BinaryExpression) {
            BinaryExpression binExpr = (BinaryExpression) expression;
            FilterNode left = compile(binExpr.getLeft(), where, context);
            FilterNode right = compile(binExpr.getRight(), where, context);
            return new BinaryExprNode(left, binExpr.getKeyword(), right);
        } else if (expression instanceof NotExpression) {
            return new NotNode(compile(((NotExpression) expression).getInner(), where, context));
        } else if (expression instanceof ComparisonExpression) {
            FilterNode node = compileComparison((ComparisonExpression) expression, where, context);
            metrics.recordFilterCompiled();
            return node;
        } else if (expression instanceof FunctionComparisonExpression) {
            FilterNode node = compileFunction((FunctionComparisonExpression) expression, where, context);
            metrics.recordFilterCompiled();
            return node;
        } else if (expression instanceof TagFunctionExpression) {
            FilterNode node = compileTagFunction((TagFunctionExpression) expression, context);
            metrics.recordFilterCompiled();
            return node;
        }
        throw new IllegalArgumentException("Unsupported expression type: "
                + (expression == null ? "null" : expression.getClass().getSimpleName()));
    }

    private FilterNode compileComparison(ComparisonExpression expr, Where where, CompilationContext context) {
        String tagName = TagResolver.stripTagName(expr.getField());
        try {
            Operator operator = OperatorNormalizer.normalize(expr.getOperator());
            if (TimeTagExtractor.isTimeTag(tagName)) {
                return TimeTagExtractor.extract(expr, operator, where.getTimeWindow());
            }
            String value = OperatorNormalizer.rewriteWildcard(operator, expr.getValue());

            ResolvedTag resolved = tagResolver.resolve(expr.getField(), context);
            if (resolved.isFound()) {
                return DescriptorFilterBuilder.build(resolved.getDescriptor().get(), operator, value);
            }
            TagFilterRequest request = new TagFilterRequest(expr.getField(), resolved.getName(), operator, value,
                    expr.toSql(), context);
            Optional<FilterNode> routed = virtualTagRouter.route(request);
            if (routed.isPresent()) {
                return routed.get();
            }
            return passThrough(expr.getField(), operator, value);
        } catch (FilterCompilationException e) {
            throw e.withContext(tagName, context.getTable(), expr.getOperator());
        }
    }

    private FilterNode compileFunction(FunctionComparisonExpression expr, Where where, CompilationContext context) {
        FunctionExpression function = expr.getFunction();
        try {
            Operator operator = OperatorNormalizer.normalize(expr.getOperator());
            if (EnumFilterBuilder.ENUM_FUNCTION.equals(function.getName())) {
                if (function.getArgs().size() != 1) {
                    throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL,
                            "Enum takes exactly one tag: " + function.toSql());
                }
                return enumFilterBuilder.build(function.getArgs().get(0), operator, expr.getValue(), context);
            }
            where.addWiths(function.getWiths());
            String value = OperatorNormalizer.rewriteWildcard(operator, expr.getValue());
            return new BinaryExprNode(new ExprNode(function.toSql()), operator.getDialect(), new ExprNode(value),
                    operator.isRegexp());
        } catch (FilterCompilationException e) {
            throw e.withContext(function.toSql(), context.getTable(), expr.getOperator());
        }
    }

    private FilterNode compileTagFunction(TagFunctionExpression expr, CompilationContext context) {
        try {
            return tagFunctionTranslator.translate(expr);
        } catch (FilterCompilationException e) {
            throw e.withContext(expr.getName() + "(" + String.join(",", expr.getArgs()) + ")",
                    context.getTable(), expr.getName());
        }
    }

    private FilterNode passThrough(String tag, Operator operator, String value) {
        metrics.recordPassThrough();
        logger.debug("Tag {} is not in the taxonomy, passed through", tag);
        if (operator.isRegexp()) {
            return new ExprNode(operator.getDialect() + "(" + tag + "," + value + ")");
        }
        return new ExprNode(tag + " " + operator.getDialect() + " " + value);
    }
}
