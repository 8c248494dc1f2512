package alertconf.rule;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VarsTest {

    @Test
    void local_vars_shadow_global_vars() {
        var expanded = Vars.expand("x > $t and ${y}", Map.of("t", "1"), Map.of("t", "2", "y", "3"), false);

        assertThat(expanded).isEqualTo("x > 1 and 3");
    }

    @Test
    void unknown_var_fails_unless_ignored() {
        assertThatThrownBy(() -> Vars.expand("$nope", Map.of(), Map.of(), false))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("$nope");

        assertThat(Vars.expand("$nope", Map.of(), Map.of(), true)).isEqualTo("$nope");
    }

    @Test
    void replacement_values_are_literal() {
        assertThat(Vars.expand("$v", Map.of("v", "a$1\\b"), Map.of(), false)).isEqualTo("a$1\\b");
    }
}
