package com.querier.query.encoder;

import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.operator.Operator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for MacValueEncoder
 */
class MacValueEncoderTest {

    @Test
    void testEncodeMacs_WithList_ShouldQuoteIntegersInParentheses() {
        String encoded = MacValueEncoder.encodeMacs(Operator.IN, "('00:00:00:00:00:01', '00:11:22:33:44:55')");

        assertThat(encoded).isEqualTo("('1','73588229205')");
    }

    @Test
    void testEncodeMacs_WithSingleValue_ShouldNotAddParentheses() {
        assertThat(MacValueEncoder.encodeMacs(Operator.NE, "'00:00:00:00:00:0a'")).isEqualTo("'10'");
    }

    @Test
    void testEncodeMacs_WithInvalidMac_ShouldThrowMalformedLiteral() {
        assertThatThrownBy(() -> MacValueEncoder.encodeMacs(Operator.EQ, "'not-a-mac'"))
            .isInstanceOf(FilterCompilationException.class)
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.MALFORMED_LITERAL);
    }

    @Test
    void testEncodeTapPorts_ShouldClassifyEachElement() {
        // Given: An IPv4, a bare MAC suffix and an opaque port name
        String value = "('10.1.1.1', '0a:0b:0c:0d', 'eth0')";

        // When: Encoding the tap port list
        String encoded = MacValueEncoder.encodeTapPorts(Operator.IN, value);

        // Then: Each element keeps its own encoding
        assertThat(encoded).isEqualTo("('167837953','168496141','eth0')");
    }

    @Test
    void testEncodeTapPorts_WithIpv6_ShouldThrowMalformedLiteral() {
        assertThatThrownBy(() -> MacValueEncoder.encodeTapPorts(Operator.EQ, "'fe80::1'"))
            .isInstanceOf(FilterCompilationException.class)
            .hasMessageContaining("invalid ipv4 mac: fe80::1");
    }

    @Test
    void testEncode_WithEmptyList_ShouldThrowMalformedLiteral() {
        assertThatThrownBy(() -> MacValueEncoder.encodeMacs(Operator.IN, "()"))
            .isInstanceOf(FilterCompilationException.class)
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.MALFORMED_LITERAL);
        assertThatThrownBy(() -> MacValueEncoder.encodeTapPorts(Operator.IN, "()"))
            .isInstanceOf(FilterCompilationException.class)
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.MALFORMED_LITERAL);
    }
}
