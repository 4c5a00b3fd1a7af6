package org.neuralchilli.actionflow.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContextSubstitutorTest {

    private final ContextSubstitutor substitutor = new ContextSubstitutor(new ExpressionEvaluator());

    @Test
    void shouldReplaceExactPlaceholderWithTypedValue() {
        // Given
        Map<String, Object> context = Map.of(
                "step_1_result", Map.of("id", "f-1", "size", 1024),
                "last_file_id", "f-1"
        );
        Map<String, Object> params = Map.of(
                "file", "${step_1_result.id}",
                "bytes", "${step_1_result.size}",
                "latest", "${last_file_id}"
        );

        // When
        Map<String, Object> result = substitutor.substitute(params, context);

        // Then
        assertThat(result)
                .containsEntry("file", "f-1")
                .containsEntry("bytes", 1024)
                .containsEntry("latest", "f-1");
    }

    @Test
    void shouldSubstituteInsideNestedMapsAndLists() {
        Map<String, Object> context = Map.of("step_1_result", Map.of("id", "c-9"));
        Map<String, Object> params = Map.of(
                "recipients", List.of("${step_1_result.id}", "static"),
                "meta", Map.of("contact", "${step_1_result.id}")
        );

        Map<String, Object> result = substitutor.substitute(params, context);

        assertThat(result.get("recipients")).isEqualTo(List.of("c-9", "static"));
        assertThat(result.get("meta")).isEqualTo(Map.of("contact", "c-9"));
    }

    @Test
    void shouldLeaveEmbeddedPlaceholdersAlone() {
        Map<String, Object> context = Map.of("step_1_result", Map.of("id", "x"));
        Map<String, Object> params = Map.of("subject", "Re: ${step_1_result.id}");

        Map<String, Object> result = substitutor.substitute(params, context);

        assertThat(result).containsEntry("subject", "Re: ${step_1_result.id}");
    }

    @Test
    void shouldLeaveUnknownRootsAndMissingPathsUnresolved() {
        Map<String, Object> context = Map.of("step_1_result", Map.of("id", "x"));
        Map<String, Object> params = Map.of(
                "unknown", "${step_9_result.id}",
                "missing", "${step_1_result.nope}"
        );

        Map<String, Object> result = substitutor.substitute(params, context);

        assertThat(result)
                .containsEntry("unknown", "${step_9_result.id}")
                .containsEntry("missing", "${step_1_result.nope}");
    }

    @Test
    void shouldNotModifyInput() {
        Map<String, Object> params = new HashMap<>();
        params.put("id", "${last_contact_id}");
        params.put("count", 3);

        Map<String, Object> result = substitutor.substitute(params, Map.of("last_contact_id", "c-1"));

        assertThat(params).containsEntry("id", "${last_contact_id}");
        assertThat(result).containsEntry("id", "c-1").containsEntry("count", 3);
    }

    @Test
    void shouldReturnEmptyForNoParams() {
        assertThat(substitutor.substitute(null, Map.of())).isEmpty();
        assertThat(substitutor.substitute(Map.of(), Map.of("a", 1))).isEmpty();
    }
}
