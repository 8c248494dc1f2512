package alertconf.rule;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LookupTest {

    private static Lookup lookup() {
        return Lookup.builder()
                .name("owner")
                .tag("host")
                .entry(new Lookup.Entry("host=web01", Map.of("host", "web01", "notify", "web")))
                .entry(new Lookup.Entry("host=web01", Map.of("host", "web01", "notify", "ops")))
                .entry(new Lookup.Entry("host=db01", Map.of("host", "db01", "other", "x")))
                .build();
    }

    @Test
    void first_matching_entry_wins() {
        var value = lookup().get("notify", TagSet.parse("host=web01"));

        assertThat(value).contains("web");
    }

    @Test
    void matching_entry_without_key_stops_resolution() {
        var value = lookup().get("notify", TagSet.parse("host=db01"));

        assertThat(value).isEmpty();
    }

    @Test
    void no_matching_entry_is_not_found() {
        assertThat(lookup().get("notify", TagSet.parse("host=web99"))).isEmpty();
    }

    @Test
    void missing_declared_tag_is_a_non_match() {
        assertThat(lookup().get("notify", TagSet.parse("env=prod"))).isEmpty();
    }

    @Test
    void values_must_equal_exactly() {
        assertThat(lookup().get("notify", TagSet.parse("host=web011"))).isEmpty();
    }

    @Test
    void every_declared_tag_must_match() {
        var lookup = Lookup.builder()
                .name("owner")
                .tag("host")
                .tag("env")
                .entry(new Lookup.Entry("host=web01", Map.of("host", "web01", "notify", "partial")))
                .entry(new Lookup.Entry("host=web01,env=prod",
                        Map.of("host", "web01", "env", "prod", "notify", "full")))
                .build();

        assertThat(lookup.get("notify", TagSet.parse("host=web01,env=prod"))).contains("full");
    }
}
