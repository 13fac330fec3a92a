package com.openrangelabs.ingestor.scheduler;

import com.openrangelabs.ingestor.exception.SchedulingException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronExpressionsTest {

    @Test
    void normalize_FiveFieldsGetASecondsField() {
        assertThat(CronExpressions.normalize("*/15 * * * *")).isEqualTo("0 */15 * * * *");
        assertThat(CronExpressions.normalize("  0 30 2 * * MON-FRI ")).isEqualTo("0 30 2 * * MON-FRI");
    }

    @Test
    void normalize_RejectsEmptyAndMalformed() {
        assertThatThrownBy(() -> CronExpressions.normalize(" "))
            .isInstanceOf(SchedulingException.class)
            .hasMessageContaining("must not be empty");
        assertThatThrownBy(() -> CronExpressions.normalize("61 * * * *"))
            .isInstanceOf(SchedulingException.class)
            .hasMessageContaining("Invalid cron expression");
        assertThat(CronExpressions.isValid("every monday")).isFalse();
        assertThat(CronExpressions.isValid("0 0 * * 1")).isTrue();
    }
}
