package alertconf.notify;

import alertconf.rule.LiveRuleConf;
import alertconf.rule.RuleConfException;
import alertconf.rule.RuleConfParser;
import alertconf.rule.Severity;
import alertconf.rule.TagSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertNotificationResolverTest {

    private static final String RULES = """
            squelch:
              - env=staging
            lookups:
              owner:
                tags: [host]
                entries:
                  - def: host=db01
                    values:
                      owner: dba
                  - def: host=db01
                    values:
                      owner: web
            notifications:
              ops:
                email: ops@example.com
                next: oncall
                timeout: 10m
              oncall:
                print: true
                next: ops
                timeout: 10m
              dba:
                email: dba@example.com
              web:
                email: web@example.com
            alerts:
              disk:
                crit: disk > 95
                warn: disk > 80
                critNotification: ops, lookup(owner)
                warnNotification: lookup(owner)
                squelch:
                  - host=test.*
            """;

    private LiveRuleConf live;
    private AlertNotificationResolver resolver;

    @BeforeEach
    void setUp() {
        live = new LiveRuleConf(new RuleConfParser());
        live.rebuild(RULES);
        resolver = new AlertNotificationResolver(live);
    }

    @Test
    void critical_resolves_static_and_lookup_notifications() {
        var resolution = resolver.resolve("disk", Severity.CRITICAL, TagSet.parse("host=db01,env=prod"));

        assertThat(resolution.isSquelched()).isFalse();
        assertThat(resolution.getNotifications()).containsOnlyKeys("ops", "dba");
        assertThat(resolution.getConfHash()).isEqualTo(live.get().getHash());
        assertThat(resolution.getChains()).containsExactlyInAnyOrder(
                List.of("ops", "oncall", "...ops"),
                List.of("dba"));
    }

    @Test
    void lookup_without_match_adds_nothing() {
        var resolution = resolver.resolve("disk", Severity.WARNING, TagSet.parse("host=web01"));

        assertThat(resolution.isSquelched()).isFalse();
        assertThat(resolution.getNotifications()).isEmpty();
        assertThat(resolution.getChains()).isEmpty();
    }

    @Test
    void alert_and_global_squelch_stop_resolution() {
        assertThat(resolver.resolve("disk", Severity.CRITICAL, TagSet.parse("host=test01")).isSquelched()).isTrue();

        var staging = resolver.resolve("disk", Severity.CRITICAL, TagSet.parse("host=db01,env=staging"));
        assertThat(staging.isSquelched()).isTrue();
        assertThat(staging.getNotifications()).isEmpty();
    }

    @Test
    void unknown_alert_is_an_error() {
        assertThatThrownBy(() -> resolver.resolve("nope", Severity.CRITICAL, TagSet.empty()))
                .isInstanceOf(RuleConfException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void resolution_follows_rebuilt_snapshot() {
        live.rebuild(RULES.replace("critNotification: ops, lookup(owner)", "critNotification: web"));

        var resolution = resolver.resolve("disk", Severity.CRITICAL, TagSet.parse("host=db01"));

        assertThat(resolution.getNotifications()).containsOnlyKeys("web");
    }
}
