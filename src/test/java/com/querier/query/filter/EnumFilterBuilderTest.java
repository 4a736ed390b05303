package com.querier.query.filter;

import com.querier.query.CompilationContext;
import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.operator.Operator;
import com.querier.tag.DefaultTagTaxonomy;
import com.querier.tag.TagDescriptionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for EnumFilterBuilder
 */
class EnumFilterBuilderTest {

    private EnumFilterBuilder builder;
    private CompilationContext l4;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream input = getClass().getResourceAsStream("/tag-descriptions.yaml")) {
            builder = new EnumFilterBuilder(DefaultTagTaxonomy.build(TagDescriptionRegistry.load(input)));
        }
        l4 = new CompilationContext("flow_log", "l4_flow_log");
    }

    @Test
    @DisplayName("Integer enum equality should also match the raw stored value")
    void testBuild_WithIntegerEnumAndNumericValue_ShouldOrRawComparison() {
        FilterNode node = builder.build("protocol", Operator.EQ, "'3'", l4);

        assertThat(node.toSql()).isEqualTo(
            "((toUInt64(protocol) IN (SELECT value FROM flow_tag.int_enum_map WHERE name = '3' and tag_name='protocol'))"
                + " OR (protocol = toUInt64(3)))");
    }

    @Test
    void testBuild_WithIntegerEnumAndName_ShouldUseDictionaryOnly() {
        FilterNode node = builder.build("protocol", Operator.EQ, "'TCP'", l4);

        assertThat(node.toSql()).isEqualTo(
            "(toUInt64(protocol) IN (SELECT value FROM flow_tag.int_enum_map WHERE name = 'TCP' and tag_name='protocol'))");
    }

    @Test
    @DisplayName("String enum inequality should conjoin the dictionary and raw comparisons")
    void testBuild_WithStringEnumNotEqual_ShouldAndRawComparison() {
        FilterNode node = builder.build("tap_side", Operator.NE, "'c'", l4);

        assertThat(node.toSql()).isEqualTo(
            "((tap_side IN (SELECT value FROM flow_tag.string_enum_map WHERE name != 'c' and tag_name='tap_side'))"
                + " AND (tap_side != 'c'))");
    }

    @Test
    void testBuild_WithLikeOperator_ShouldRewriteWildcard() {
        FilterNode node = builder.build("protocol", Operator.LIKE, "'T*'", l4);

        assertThat(node.toSql()).isEqualTo(
            "(toUInt64(protocol) IN (SELECT value FROM flow_tag.int_enum_map WHERE name ilike 'T%' and tag_name='protocol'))");
    }

    @Test
    void testBuild_WithRegexp_ShouldUseMatchFunction() {
        FilterNode node = builder.build("protocol", Operator.REGEXP, "'^T'", l4);

        assertThat(node.toSql()).isEqualTo(
            "(toUInt64(protocol) IN (SELECT value FROM flow_tag.int_enum_map WHERE match(name,'^T') and tag_name='protocol'))");
    }

    @Test
    void testBuild_WithTableSpecificDictionary_ShouldUseTableEntry() {
        CompilationContext l7 = new CompilationContext("flow_log", "l7_flow_log");

        FilterNode node = builder.build("type", Operator.EQ, "0", l7);

        assertThat(node.toSql()).isEqualTo(
            "((toUInt64(type) IN (SELECT value FROM flow_tag.int_enum_map WHERE name = 0 and tag_name='l7_log_type'))"
                + " OR (type = toUInt64(0)))");
    }

    @Test
    void testBuild_WithUnknownTag_ShouldThrowUnknownRegistryEntry() {
        assertThatThrownBy(() -> builder.build("foo", Operator.EQ, "'1'", l4))
            .isInstanceOf(FilterCompilationException.class)
            .hasMessage("no tag foo in flow_log.l4_flow_log")
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.UNKNOWN_REGISTRY_ENTRY);
    }

    @Test
    void testEnumArgument_ShouldStripFunctionAndBackQuotes() {
        assertThat(EnumFilterBuilder.isEnumReference("Enum(`protocol`)")).isTrue();
        assertThat(EnumFilterBuilder.isEnumReference("protocol")).isFalse();
        assertThat(EnumFilterBuilder.enumArgument("Enum(`protocol`)")).isEqualTo("protocol");
    }
}
