package com.querier.tag;

import com.querier.query.CompilationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for TagResolver
 */
class TagResolverTest {

    private TagResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TagResolver(DefaultTagTaxonomy.build(new TagDescriptionRegistry(Map.of(), Set.of())));
    }

    @Test
    void testResolve_WithBackQuotedTag_ShouldFindDescriptor() {
        ResolvedTag resolved = resolver.resolve(" `pod_ns_0` ", new CompilationContext("flow_log", "l4_flow_log"));

        assertThat(resolved.isFound()).isTrue();
        assertThat(resolved.getName()).isEqualTo("pod_ns_0");
        assertThat(resolved.getOriginalTag()).isEqualTo(" `pod_ns_0` ");
    }

    @Test
    void testResolve_WithAlias_ShouldUseCanonicalTag() {
        CompilationContext context = new CompilationContext("flow_log", "l4_flow_log",
            Map.of("client", "chost_0"), false);

        ResolvedTag resolved = resolver.resolve("`client`", context);

        assertThat(resolved.isFound()).isTrue();
        assertThat(resolved.getName()).isEqualTo("chost_0");
        assertThat(resolved.getDescriptor()).hasValueSatisfying(
            descriptor -> assertThat(descriptor.getCategory()).isEqualTo(TagCategory.SUBQUERY));
    }

    @Test
    void testResolve_WithDirectNameShadowingAlias_ShouldPreferDirectName() {
        CompilationContext context = new CompilationContext("flow_log", "l4_flow_log",
            Map.of("pod", "pod_ns"), false);

        ResolvedTag resolved = resolver.resolve("pod", context);

        assertThat(resolved.getName()).isEqualTo("pod");
    }

    @Test
    void testResolve_WithUnknownTag_ShouldReturnMiss() {
        ResolvedTag resolved = resolver.resolve("byte_tx", new CompilationContext("flow_log", "l4_flow_log"));

        assertThat(resolved.isFound()).isFalse();
        assertThat(resolved.getDescriptor()).isEmpty();
        assertThat(resolved.getName()).isEqualTo("byte_tx");
    }

    @Test
    void testResolve_WithTagOfAnotherDatabase_ShouldReturnMiss() {
        ResolvedTag resolved = resolver.resolve("pod_ns", new CompilationContext("ext_metrics", "metrics"));

        assertThat(resolved.isFound()).isFalse();
    }

    @Test
    void testStripTagName() {
        assertThat(TagResolver.stripTagName("``k8s.label.app``")).isEqualTo("k8s.label.app");
        assertThat(TagResolver.stripTagName("  ip ")).isEqualTo("ip");
    }
}
