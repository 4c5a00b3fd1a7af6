package org.neuralchilli.actionflow.action;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ActionRegistryTest {

    @Test
    void shouldLookUpActionsByName() {
        ScriptedAction upload = ScriptedAction.echo("onedrive_upload_file");
        ActionRegistry registry = new ActionRegistry(List.of(upload, ScriptedAction.echo("outlook_send_email")));

        assertThat(registry.find("onedrive_upload_file")).containsSame(upload);
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.contains("outlook_send_email")).isTrue();
        assertThat(registry.names()).containsExactly("onedrive_upload_file", "outlook_send_email");
        assertThat(registry.byCategory("general")).hasSize(2);
    }

    @Test
    void shouldReplaceActionWithSameName() {
        ActionRegistry registry = new ActionRegistry(List.of(ScriptedAction.echo("outlook_send_email")));
        ScriptedAction replacement = ScriptedAction.returning("outlook_send_email", Map.of("sent", true));

        registry.register(replacement);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.find("outlook_send_email")).containsSame(replacement);
    }
}
