package com.querier.query.encoder;

import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.operator.Operator;
import com.querier.tag.WhereTranslator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for IpFilterEncoder
 */
@DisplayName("IpFilterEncoder Tests")
class IpFilterEncoderTest {

    private final WhereTranslator ip4 = (op, value) -> "hex(ip4) " + op + " " + value;

    @Test
    @DisplayName("CIDR with = compiles to a closed range")
    void shouldCompileCidrEqualityToRange() {
        String filter = IpFilterEncoder.encode(Operator.EQ, "'10.0.0.1/24'", ip4);

        assertThat(filter).isEqualTo("(((hex(ip4) >= '0A000000' AND hex(ip4) <= '0A0000FF')))");
    }

    @Test
    @DisplayName("CIDR with range operators compiles to a single bound")
    void shouldCompileCidrRangeToSingleBound() {
        assertThat(IpFilterEncoder.encode(Operator.GE, "'10.0.0.0/24'", ip4))
            .isEqualTo("((hex(ip4) >= '0A0000FF'))");
        assertThat(IpFilterEncoder.encode(Operator.GT, "'10.0.0.0/24'", ip4))
            .isEqualTo("((hex(ip4) > '0A0000FF'))");
        assertThat(IpFilterEncoder.encode(Operator.LE, "'10.0.0.0/24'", ip4))
            .isEqualTo("((hex(ip4) <= '0A000000'))");
        assertThat(IpFilterEncoder.encode(Operator.LT, "'10.0.0.0/24'", ip4))
            .isEqualTo("((hex(ip4) < '0A000000'))");
    }

    @Test
    @DisplayName("Negated operators wrap the positive form in not()")
    void shouldNegateWithNot() {
        String positive = IpFilterEncoder.encode(Operator.EQ, "'10.0.0.1/24'", ip4);

        assertThat(IpFilterEncoder.encode(Operator.NE, "'10.0.0.1/24'", ip4))
            .isEqualTo("not(" + positive + ")");
        assertThat(IpFilterEncoder.encode(Operator.NOT_IN, "('1.1.1.1')", ip4))
            .isEqualTo("not(((hex(ip4) in ('01010101'))))");
    }

    @Test
    void testEncode_WithIpList_ShouldUseInOperator() {
        // Given: Two IPv4 literals
        String value = "('1.1.1.1', '2.2.2.2')";

        // When: Encoding with in
        String filter = IpFilterEncoder.encode(Operator.IN, value, ip4);

        // Then: Both hex literals appear in one in-list
        assertThat(filter).isEqualTo("((hex(ip4) in ('01010101','02020202')))");
    }

    @Test
    void testEncode_WithMixedCidrAndIp_ShouldOrBoth() {
        String filter = IpFilterEncoder.encode(Operator.IN, "('192.168.0.0/16','8.8.8.8')", ip4);

        assertThat(filter).isEqualTo("(((hex(ip4) >= 'C0A80000' AND hex(ip4) <= 'C0A8FFFF')) OR (hex(ip4) in ('08080808')))");
    }

    @Test
    void testEncode_WithIpv6_ShouldUseFullWidthHex() {
        String filter = IpFilterEncoder.encode(Operator.EQ, "'::1'", ip4);

        assertThat(filter).isEqualTo("((hex(ip4) = '00000000000000000000000000000001'))");
    }

    @Test
    void testEncode_WithMalformedLiteral_ShouldThrowMalformedLiteral() {
        assertThatThrownBy(() -> IpFilterEncoder.encode(Operator.EQ, "'10.0.0.300'", ip4))
            .isInstanceOf(FilterCompilationException.class)
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.MALFORMED_LITERAL);
        assertThatThrownBy(() -> IpFilterEncoder.encode(Operator.EQ, "'10.0.0.0/40'", ip4))
            .isInstanceOf(FilterCompilationException.class)
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.MALFORMED_LITERAL);
    }

    @Test
    @DisplayName("An empty value list is rejected instead of rendering empty parentheses")
    void testEncode_WithEmptyList_ShouldThrowMalformedLiteral() {
        assertThatThrownBy(() -> IpFilterEncoder.encode(Operator.IN, "()", ip4))
            .isInstanceOf(FilterCompilationException.class)
            .hasMessage("empty value list: ()")
            .extracting(e -> ((FilterCompilationException) e).getKind())
            .isEqualTo(ErrorKind.MALFORMED_LITERAL);
    }
}
