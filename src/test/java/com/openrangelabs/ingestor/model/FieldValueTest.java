package com.openrangelabs.ingestor.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldValueTest {

    @Test
    void from_NormalisesDriverValues() {
        assertThat(FieldValue.from(7).kind()).isEqualTo(FieldValue.Kind.NUMBER);
        assertThat(FieldValue.from(null).isNull()).isTrue();
        assertThat(FieldValue.from(Double.NaN).kind()).isEqualTo(FieldValue.Kind.STRING);
        assertThat(FieldValue.from(LocalDateTime.parse("2024-01-02T03:04:05")).asTimestamp())
            .contains(Instant.parse("2024-01-02T03:04:05Z"));
    }

    @Test
    void numbersCompareByValueNotScale() {
        assertThat(FieldValue.of(new BigDecimal("1.50"))).isEqualTo(FieldValue.of(1.5d));
        assertThat(FieldValue.of(new BigDecimal("1.50")).hashCode()).isEqualTo(FieldValue.of(1.5d).hashCode());
    }

    @Test
    void stringsCoerceToNumberAndTimestamp() {
        assertThat(FieldValue.of(" 42.5 ").asNumber()).contains(new BigDecimal("42.5"));
        assertThat(FieldValue.of("n/a").asNumber()).isEmpty();
        assertThat(FieldValue.of("2024-05-01T10:00:00+02:00").asTimestamp())
            .contains(Instant.parse("2024-05-01T08:00:00Z"));
        assertThat(FieldValue.of("TRUE").asBoolean()).contains(true);
    }

    @Test
    void toTransportSafe_RendersBinaryAndTimestampsAsText() {
        FieldValue binary = FieldValue.of(new byte[] {1, 2, 3});
        FieldValue time = FieldValue.of(Instant.parse("2024-05-01T08:00:00Z"));

        assertThat(binary.toTransportSafe()).isEqualTo(FieldValue.of("AQID"));
        assertThat(time.toTransportSafe()).isEqualTo(FieldValue.of("2024-05-01T08:00:00Z"));
        assertThat(FieldValue.of(3L).toTransportSafe().kind()).isEqualTo(FieldValue.Kind.NUMBER);
    }

    @Test
    void binaryIsDefensivelyCopied() {
        byte[] bytes = {9};
        FieldValue value = FieldValue.of(bytes);
        bytes[0] = 0;

        assertThat(value.asBinary().orElseThrow()).containsExactly(9);
    }

    @Test
    void dataRow_CopyIsIndependent() {
        DataRow row = DataRow.of(Map.of("id", 1));
        DataRow copy = row.copy().set("extra", "x");
        copy.remove("id");

        assertThat(row.has("id")).isTrue();
        assertThat(row.has("extra")).isFalse();
        assertThat(row.get("missing").isNull()).isTrue();
        assertThat(row.toPlainMap()).containsEntry("id", BigDecimal.valueOf(1L));
    }
}
