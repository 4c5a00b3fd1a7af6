package org.neuralchilli.actionflow.core;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class ExpressionEvaluatorTest {

    @Inject
    ExpressionEvaluator evaluator;

    @Test
    void shouldResolveNestedPath() {
        Map<String, Object> context = Map.of(
                "step_1_result", Map.of("user", Map.of("id", "u-42"))
        );

        Object result = evaluator.evaluate("step_1_result.user.id", context);

        assertThat(result).isEqualTo("u-42");
    }

    @Test
    void shouldPreserveValueType() {
        Map<String, Object> context = Map.of(
                "step_1_result", Map.of("count", 7, "tags", List.of("a", "b"))
        );

        assertThat(evaluator.evaluate("step_1_result.count", context)).isEqualTo(7);
        assertThat(evaluator.evaluate("step_1_result.tags", context)).isEqualTo(List.of("a", "b"));
    }

    @Test
    void shouldResolveMissingPropertyToNull() {
        Map<String, Object> context = Map.of("step_1_result", Map.of("id", "x"));

        assertThat(evaluator.evaluate("step_1_result.absent", context)).isNull();
    }

    @Test
    void shouldRejectEmptyExpression() {
        assertThatThrownBy(() -> evaluator.evaluate(" ", Map.of()))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void shouldWrapSyntaxErrors() {
        assertThatThrownBy(() -> evaluator.evaluate("1 +", Map.of()))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("Failed to evaluate expression");
    }

    @Test
    void shouldValidateExpressions() {
        assertThat(evaluator.isValid("step_1_result.id")).isTrue();
        assertThat(evaluator.isValid("1 +")).isFalse();
        assertThat(evaluator.isValid(null)).isFalse();
    }
}
