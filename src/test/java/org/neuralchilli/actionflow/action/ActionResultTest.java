package org.neuralchilli.actionflow.action;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ActionResultTest {

    @Test
    void shouldNeverLetErrorLookSuccessful() {
        ActionResult result = ActionResult.error(null, 200, "bad input");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorKind()).isEqualTo("unknown_error");
        assertThat(result.httpStatus()).isEqualTo(500);
    }

    @Test
    void shouldKeepErrorCodeAndKind() {
        ActionResult result = ActionResult.error("not_found", 404, "No such file");

        assertThat(result.toMap())
                .containsEntry("status", "error")
                .containsEntry("http_status", 404)
                .containsEntry("error_kind", "not_found")
                .containsEntry("message", "No such file")
                .doesNotContainKey("data");
    }

    @Test
    void shouldExposeSuccessData() {
        ActionResult result = ActionResult.success(Map.of("id", "f-1"));

        assertThat(result.httpStatus()).isEqualTo(200);
        assertThat(result.toMap())
                .containsEntry("status", "success")
                .containsEntry("data", Map.of("id", "f-1"));
    }

    @Test
    void shouldRequireStatus() {
        assertThatThrownBy(() -> new ActionResult(null, null, null, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
