package com.openrangelabs.ingestor.transformation;

import com.openrangelabs.ingestor.model.DataRow;
import org.junit.jupiter.api.Test;
import org.springframework.expression.EvaluationException;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionEvaluatorTest {

    private static final DataRow ROW = DataRow.of(Map.of("price", 2, "quantity", 3, "unit-cost", 1));

    @Test
    void evaluate_BindsFieldsAsVariables() {
        ExpressionEvaluator evaluator = new ExpressionEvaluator();

        assertThat(evaluator.evaluate("#price * #quantity - #unit_cost", ROW).asNumber())
            .contains(BigDecimal.valueOf(5));
        assertThat(evaluator.evaluateCondition("#quantity > 2", ROW)).isTrue();
    }

    @Test
    void cacheStaysBoundedForManyDistinctExpressions() {
        // Arrange
        ExpressionEvaluator evaluator = new ExpressionEvaluator(8);

        // Act
        for (int i = 0; i < 200; i++) {
            evaluator.evaluate("#price + " + i, ROW);
        }

        // Assert
        assertThat(evaluator.cachedExpressionCount()).isLessThanOrEqualTo(8);
        assertThat(evaluator.evaluate("#price + 199", ROW).asNumber()).contains(BigDecimal.valueOf(201));
    }

    @Test
    void invalidExpression_IsEvaluationException() {
        ExpressionEvaluator evaluator = new ExpressionEvaluator();

        assertThatThrownBy(() -> evaluator.evaluate("#price +", ROW))
            .isInstanceOf(EvaluationException.class)
            .hasMessageContaining("Invalid expression '#price +'");
        assertThat(evaluator.cachedExpressionCount()).isZero();
    }
}
