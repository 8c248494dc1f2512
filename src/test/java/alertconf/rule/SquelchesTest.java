package alertconf.rule;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SquelchesTest {

    private static final TagSet WEB01 = TagSet.of(Map.of("host", "web01", "env", "prod"));

    @Test
    void empty_list_never_squelches() {
        var squelches = new Squelches();

        assertThat(squelches.squelched(WEB01)).isFalse();
        assertThat(squelches.squelched(TagSet.empty())).isFalse();
    }

    @Test
    void rule_with_key_missing_from_tags_does_not_match() {
        var squelches = new Squelches();
        squelches.add("host=web.*,dc=ams");

        assertThat(squelches.squelched(WEB01)).isFalse();
    }

    @Test
    void all_keys_of_a_rule_must_match() {
        var squelches = new Squelches();
        squelches.add("host=web.*,env=staging");

        assertThat(squelches.squelched(WEB01)).isFalse();
        assertThat(squelches.squelched(TagSet.of(Map.of("host", "web02", "env", "staging")))).isTrue();
    }

    @Test
    void any_matching_rule_squelches() {
        var squelches = new Squelches();
        squelches.add("host=db.*");
        squelches.add("env=prod");
        squelches.add("host=nothing");

        assertThat(squelches.squelched(WEB01)).isTrue();
    }

    @Test
    void pattern_uses_substring_search_unless_anchored() {
        var squelches = new Squelches();
        squelches.add("host=eb0");

        assertThat(squelches.squelched(WEB01)).isTrue();

        var anchored = new Squelches();
        anchored.add("host=^eb0$");

        assertThat(anchored.squelched(WEB01)).isFalse();
    }

    @Test
    void empty_expression_adds_rule_that_never_matches() {
        var squelches = new Squelches();
        squelches.add("");

        assertThat(squelches.size()).isEqualTo(1);
        assertThat(squelches.squelched(WEB01)).isFalse();
    }

    @Test
    void invalid_regex_is_rejected_without_adding_rule() {
        var squelches = new Squelches();

        assertThatThrownBy(() -> squelches.add("host=web.*,env=(prod"))
                .isInstanceOf(SquelchRegexException.class)
                .hasMessageContaining("env");
        assertThat(squelches.isEmpty()).isTrue();
    }

    @Test
    void malformed_expression_is_rejected_without_adding_rule() {
        var squelches = new Squelches();

        assertThatThrownBy(() -> squelches.add("host"))
                .isInstanceOf(TagParseException.class);
        assertThat(squelches.isEmpty()).isTrue();
    }
}
