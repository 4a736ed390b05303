package com.querier.query;

import com.querier.prometheus.AppLabelLayout;
import com.querier.prometheus.InMemoryPrometheusRegistry;
import com.querier.prometheus.PrometheusFilterTranslator;
import com.querier.prometheus.PrometheusSubqueryCache;
import com.querier.prometheus.RemoteReadFilterTranslator;
import com.querier.prometheus.TargetLabelFilter;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.filter.EnumFilterBuilder;
import com.querier.query.filter.FilterNode;
import com.querier.query.filter.Having;
import com.querier.query.filter.Where;
import com.querier.query.filter.WithClause;
import com.querier.storage.QueryClient;
import com.querier.tag.DefaultTagTaxonomy;
import com.querier.tag.TagDescriptionRegistry;
import com.querier.tag.TagRegistry;
import com.querier.tag.TagResolver;
import com.querier.tag.family.TagFunctionTranslator;
import com.querier.tag.family.VirtualTagRouter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests for WhereCompiler running against the bundled taxonomy
 */
@ExtendWith(MockitoExtension.class)
class WhereCompilerTest {

    @Mock
    private QueryClient queryClient;

    private FilterMetrics metrics;
    private WhereCompiler compiler;
    private CompilationContext l4;

    @BeforeEach
    void setUp() throws Exception {
        TagRegistry registry;
        try (InputStream input = getClass().getResourceAsStream("/tag-descriptions.yaml")) {
            registry = DefaultTagTaxonomy.build(TagDescriptionRegistry.load(input));
        }
        InMemoryPrometheusRegistry prometheusRegistry = new InMemoryPrometheusRegistry();
        prometheusRegistry.replace(
            Map.of("node_cpu", 7),
            Map.of("instance", 3, "job", 4),
            Map.of("node_cpu", List.of(new AppLabelLayout("job", 1))));
        metrics = new FilterMetrics(new SimpleMeterRegistry());
        metrics.init();

        PrometheusFilterTranslator prometheusFilterTranslator = new PrometheusFilterTranslator(prometheusRegistry);
        PrometheusSubqueryCache cache = new PrometheusSubqueryCache(64, 60,
            Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
        RemoteReadFilterTranslator remoteRead = new RemoteReadFilterTranslator(prometheusFilterTranslator, cache,
            queryClient, metrics);
        EnumFilterBuilder enumFilterBuilder = new EnumFilterBuilder(registry);

        compiler = new WhereCompiler(new TagResolver(registry),
            new VirtualTagRouter(registry, prometheusFilterTranslator, remoteRead, enumFilterBuilder),
            enumFilterBuilder, new TagFunctionTranslator(), metrics);
        l4 = new CompilationContext("flow_log", "l4_flow_log");
    }

    private String compile(Expression expression, CompilationContext context) {
        return compiler.compile(expression, new Where(), context).toSql();
    }

    @Test
    void testCompile_WithMappedResource_ShouldUseMembershipSubquery() {
        String sql = compile(new ComparisonExpression("pod_ns", "=", "'default'"), l4);

        assertThat(sql).isEqualTo("(toUInt64(pod_ns_id) IN (SELECT id FROM flow_tag.pod_ns_map WHERE name = 'default'))");
        assertThat(metrics.getFiltersCompiled().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("An AS alias should compile as the tag it names")
    void testCompile_WithAlias_ShouldTranslateCanonicalTag() {
        CompilationContext context = new CompilationContext("flow_log", "l4_flow_log",
            Map.of("client", "chost_0"), false);

        String sql = compile(new ComparisonExpression("`client`", "=", "'vm1'"), context);

        assertThat(sql).isEqualTo("(toUInt64(l3_device_id_0) IN (SELECT deviceid FROM flow_tag.device_map"
            + " WHERE name = 'vm1' AND devicetype=1) AND l3_device_type_0=1)");
    }

    @Test
    void testCompile_WithUpperCaseOperatorAndWildcard_ShouldUseIlike() {
        String sql = compile(new ComparisonExpression("pod", "LIKE", "'web-*'"), l4);

        assertThat(sql).isEqualTo("(toUInt64(pod_id) IN (SELECT id FROM flow_tag.pod_map WHERE name ilike 'web-%'))");
    }

    @Test
    void testCompile_WithNegatedIp_ShouldWrapInNot() {
        String sql = compile(new ComparisonExpression("ip_0", "!=", "'10.0.0.1'"), l4);

        assertThat(sql).isEqualTo("(not(((if(is_ipv4=1, hex(ip4_0), hex(ip6_0)) = '0A000001'))))");
    }

    @Test
    void testCompile_WithBothInternetValues_ShouldMatchEverything() {
        assertThat(compile(new ComparisonExpression("is_internet", "in", "(0,1)"), l4)).isEqualTo("(1=1)");
    }

    @Test
    void testCompile_WithBooleanTree_ShouldFoldAndOrNot() {
        // Given: (pod_ns = 'a' or byte_tx > 10) and not(l7_error > 0)
        Expression expression = new BinaryExpression("and",
            new BinaryExpression("or",
                new ComparisonExpression("pod_ns", "=", "'a'"),
                new ComparisonExpression("byte_tx", ">", "10")),
            new NotExpression(new ComparisonExpression("l7_error", ">", "0")));

        // When
        String sql = compile(expression, l4);

        // Then
        assertThat(sql).isEqualTo("(((toUInt64(pod_ns_id) IN (SELECT id FROM flow_tag.pod_ns_map WHERE name = 'a'))"
            + " OR byte_tx > 10) AND not(l7_error > 0))");
        assertThat(metrics.getPassThroughFilters().count()).isEqualTo(2.0);
    }

    @Test
    void testCompile_WithUnknownTagAndRegexp_ShouldPassThroughAsFunction() {
        assertThat(compile(new ComparisonExpression("`server_port`", "regexp", "'^80'"), l4))
            .isEqualTo("match(`server_port`,'^80')");
    }

    @Test
    void testCompile_WithMacColumn_ShouldEncodeValues() {
        assertThat(compile(new ComparisonExpression("mac_0", "in", "('00:00:00:00:00:01','00:00:00:00:00:02')"), l4))
            .isEqualTo("mac_0 in ('1','2')");
    }

    @Test
    void testCompile_WithTimeBounds_ShouldFillTimeWindow() {
        Where where = new Where();

        FilterNode node = compiler.compile(new ComparisonExpression("time", ">=", "1700000000 - 3600"), where, l4);

        assertThat(node.toSql()).isEqualTo("time >= 1700000000 - 3600");
        assertThat(where.getTimeWindow().getStart()).hasValue(1699996400L);
    }

    @Test
    void testCompile_WithEnumFunction_ShouldUseDictionary() {
        Expression expression = new FunctionComparisonExpression(
            new FunctionExpression("Enum", List.of("protocol")), "=", "'3'");

        assertThat(compile(expression, l4)).isEqualTo(
            "((toUInt64(protocol) IN (SELECT value FROM flow_tag.int_enum_map WHERE name = '3' and tag_name='protocol'))"
                + " OR (protocol = toUInt64(3)))");
    }

    @Test
    void testCompile_WithEnumFunctionOfTwoArguments_ShouldThrowMalformedLiteral() {
        Expression expression = new FunctionComparisonExpression(
            new FunctionExpression("Enum", List.of("protocol", "tap_side")), "=", "'3'");

        assertThatThrownBy(() -> compile(expression, l4))
            .isInstanceOf(FilterCompilationException.class)
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.MALFORMED_LITERAL);
    }

    @Test
    @DisplayName("Function filters should register their WITH expressions on the clause")
    void testAddHaving_WithFunctionFilter_ShouldCollectWiths() {
        // Given
        WithClause with = new WithClause("toStartOfHour(time)", "hour");
        Expression expression = new FunctionComparisonExpression(
            new FunctionExpression("Sum", List.of("byte"), List.of(with)), ">", "100");
        Having having = new Having();

        // When
        compiler.addHaving(expression, having, l4);

        // Then
        assertThat(having.toClause()).hasValue("HAVING (Sum(byte) > 100)");
        assertThat(having.getWiths()).containsExactly(with);
    }

    @Test
    void testCompile_WithRegexpOverFunction_ShouldUseFunctionForm() {
        Expression expression = new FunctionComparisonExpression(
            new FunctionExpression("toString", List.of("server_port")), "regexp", "'^80'");

        assertThat(compile(expression, l4)).isEqualTo("match(toString(server_port),'^80')");
    }

    @Test
    void testCompile_WithExistFunction_ShouldFilterDeviceType() {
        assertThat(compile(new TagFunctionExpression("exist", List.of("chost_1")), l4)).isEqualTo("l3_device_type_1=1");
    }

    @Test
    @DisplayName("Failures should carry the tag, table and operator and count as failed compilations")
    void testAddWhere_WithUnsupportedOperator_ShouldThrowWithContext() {
        Expression expression = new BinaryExpression("and",
            new ComparisonExpression("pod_ns", "=", "'a'"),
            new ComparisonExpression("`pod`", "~=", "'b'"));

        assertThatThrownBy(() -> compiler.addWhere(expression, new Where(), l4))
            .isInstanceOf(FilterCompilationException.class)
            .hasMessage("operator: ~= not support [Tag: pod] [Table: l4_flow_log] [Operator: ~=]")
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.UNSUPPORTED_OPERATOR);
        assertThat(metrics.getCompilationsFailed().count()).isEqualTo(1.0);
    }

    @Test
    void testCompile_WithUnknownPrometheusLabel_ShouldThrowUnknownRegistryEntry() {
        CompilationContext prometheus = new CompilationContext("prometheus", "node_cpu");

        assertThatThrownBy(() -> compile(new ComparisonExpression("tag.pod", "=", "'a'"), prometheus))
            .isInstanceOf(FilterCompilationException.class)
            .hasMessageContaining("pod not found")
            .hasMessageContaining("[Tag: tag.pod]");
    }

    @Test
    void testCompile_WithRemoteReadTargetLabel_ShouldDeferWithoutQuery() {
        CompilationContext remote = new CompilationContext("prometheus", "node_cpu", Map.of(), true);

        FilterNode node = compiler.compile(new ComparisonExpression("tag.instance", "=", "'h1'"), new Where(), remote);

        assertThat(node).isInstanceOf(TargetLabelFilter.class);
        assertThat(remote.getTargetLabelFilters()).hasSize(1);
        assertThat(remote.getTargetLabelFilters().get(0).getOriginFilter()).isEqualTo("tag.instance = 'h1'");
        verify(queryClient, never()).query(anyString());
    }

    @Test
    void testCompile_WithUnsupportedExpression_ShouldThrowIllegalArgument() {
        Expression unknown = new Expression() {
        };

        assertThatThrownBy(() -> compile(unknown, l4))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Unsupported expression type");
    }

    @Test
    @DisplayName("Flow log ids should also pin the time encoded in their upper 32 bits")
    void testCompile_WithFlowLogId_ShouldAddTimeFromIdBits() {
        String sql = compile(new ComparisonExpression("_id", "in", "(4294967296,8589934592)"), l4);

        assertThat(sql).isEqualTo("((("
            + "_id = 4294967296 AND time=toDateTime(bitShiftRight(4294967296, 32))) OR ("
            + "_id = 8589934592 AND time=toDateTime(bitShiftRight(8589934592, 32)))))");
    }

    @Test
    void testCompile_WithAclGids_ShouldUseHasAnyAndNegateWithNot() {
        CompilationContext network = new CompilationContext("flow_metrics", "network");

        assertThat(compile(new ComparisonExpression("acl_gids", "in", "(1,2)"), network))
            .isEqualTo("(hasAny(acl_gids, [1,2]))");
        assertThat(compile(new ComparisonExpression("acl_gids", "not in", "(1,2)"), network))
            .isEqualTo("(not(hasAny(acl_gids, [1,2])))");
    }

    @Test
    @DisplayName("An empty value list inside a disjunction should fail instead of dropping the branch")
    void testAddWhere_WithEmptyListUnderOr_ShouldThrowMalformedLiteral() {
        // Given
        Expression expression = new BinaryExpression("or",
            new ComparisonExpression("pod", "=", "'a'"),
            new ComparisonExpression("ip_version", "in", "()"));

        // When / Then
        assertThatThrownBy(() -> compiler.addWhere(expression, new Where(), l4))
            .isInstanceOf(FilterCompilationException.class)
            .hasMessage("empty value list: () [Tag: ip_version] [Table: l4_flow_log] [Operator: in]")
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.MALFORMED_LITERAL);
    }

    @Test
    void testCompile_WithEmptyIpList_ShouldThrowMalformedLiteral() {
        assertThatThrownBy(() -> compile(new ComparisonExpression("ip", "in", "()"), l4))
            .isInstanceOf(FilterCompilationException.class)
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.MALFORMED_LITERAL);
    }

    @Test
    void testCompile_WithUnknownOperatorOnTime_ShouldThrowUnsupportedOperator() {
        Where where = new Where();

        assertThatThrownBy(() -> compiler.compile(new ComparisonExpression("time", "~=", "5"), where, l4))
            .isInstanceOf(FilterCompilationException.class)
            .hasMessage("operator: ~= not support [Tag: time] [Table: l4_flow_log] [Operator: ~=]")
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.UNSUPPORTED_OPERATOR);
        assertThat(where.getTimeWindow().getStart()).isEmpty();
    }

    @Test
    void testCompile_WithExistOfTwoArguments_ShouldThrowWithContext() {
        Expression expression = new TagFunctionExpression("exist", List.of("chost_0", "chost_1"));

        assertThatThrownBy(() -> compile(expression, l4))
            .isInstanceOf(FilterCompilationException.class)
            .hasMessage("The parameters of function exist are not 1"
                + " [Tag: exist(chost_0,chost_1)] [Table: l4_flow_log] [Operator: exist]")
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.MALFORMED_LITERAL);
    }
}
