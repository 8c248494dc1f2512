package alertconf.edit;

import alertconf.rule.RuleConfParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandSaveHookTest {

    private static final String RULES = """
            alerts:
              cpu:
                crit: cpu > 90
            """;

    @TempDir
    Path dir;

    private Path script(String name, String body) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file;
    }

    @Test
    void passes_files_user_message_and_args_in_order() throws Exception {
        Path out = dir.resolve("args.txt");
        Path cmd = script("record.sh", "printf '%s\\n' \"$@\" > '" + out + "'");
        var hook = CommandSaveHook.create(cmd.toString(), Duration.ofSeconds(5));

        hook.onSave("/etc/rules.yaml", "alice", "raise threshold", "a1", "a2");

        assertThat(Files.readAllLines(out, StandardCharsets.UTF_8))
                .containsExactly("/etc/rules.yaml", "alice", "raise threshold", "a1", "a2");
    }

    @Test
    void non_zero_exit_reports_stderr() throws Exception {
        Path cmd = script("fail.sh", "echo 'git push rejected' >&2\nexit 3");
        var hook = CommandSaveHook.create(cmd.toString(), Duration.ofSeconds(5));

        assertThatThrownBy(() -> hook.onSave("f", "u", "m"))
                .isInstanceOf(HookExecutionException.class)
                .hasMessageContaining("git push rejected")
                .satisfies(e -> assertThat(((HookExecutionException) e).getStderr()).contains("git push rejected"));
    }

    @Test
    void missing_command_is_rejected_at_creation() {
        assertThatThrownBy(() -> CommandSaveHook.create(dir.resolve("nope.sh").toString(), null))
                .isInstanceOf(HookNotFoundException.class)
                .hasMessageContaining("nope.sh");
        assertThatThrownBy(() -> CommandSaveHook.create("surely-not-a-command-on-path-42", null))
                .isInstanceOf(HookNotFoundException.class);
    }

    @Test
    void command_name_is_resolved_from_path() {
        var hook = CommandSaveHook.create("sh", null);

        assertThat(hook.getCommand()).isAbsolute();
        assertThat(hook.getTimeout()).isEqualTo(CommandSaveHook.DEFAULT_TIMEOUT);
    }

    @Test
    void slow_hook_times_out() throws Exception {
        Path cmd = script("slow.sh", "sleep 10");
        var hook = CommandSaveHook.create(cmd.toString(), Duration.ofMillis(300));

        assertThatThrownBy(() -> hook.onSave("f", "u", "m"))
                .isInstanceOf(HookExecutionException.class);
    }

    @Test
    void store_keeps_saved_text_when_hook_fails() throws Exception {
        Path ruleFile = dir.resolve("rules.yaml");
        var store = RuleConfStore.open(ruleFile, new RuleConfParser());
        Path cmd = script("fail.sh", "echo 'no remote' >&2\nexit 1");
        store.setSaveHook(CommandSaveHook.create(cmd.toString(), Duration.ofSeconds(5)));

        assertThatThrownBy(() -> store.saveRawText(RULES, null, "bob", "init"))
                .isInstanceOf(HookExecutionException.class)
                .hasMessageContaining("no remote");

        assertThat(store.getRawText()).isEqualTo(RULES);
        assertThat(Files.readString(ruleFile, StandardCharsets.UTF_8)).isEqualTo(RULES);
    }

    @Test
    void store_runs_successful_hook() throws Exception {
        Path ruleFile = dir.resolve("rules.yaml");
        Path marker = dir.resolve("committed");
        var store = RuleConfStore.open(ruleFile, new RuleConfParser());
        Path cmd = script("ok.sh", "echo \"$2\" > '" + marker + "'");
        store.setSaveHook(CommandSaveHook.create(cmd.toString(), Duration.ofSeconds(5)));

        store.saveRawText(RULES, null, "carol", "init");

        assertThat(store.getRawText()).isEqualTo(RULES);
        assertThat(Files.readString(marker, StandardCharsets.UTF_8).trim()).isEqualTo("carol");
    }
}
