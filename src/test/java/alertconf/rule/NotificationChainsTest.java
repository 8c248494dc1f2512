package alertconf.rule;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationChainsTest {

    private final Map<String, Notification> registry = new HashMap<>();

    private Notification notification(String name, String next) {
        var n = Notification.builder().name(name).nextName(next).build();
        registry.put(name, n);
        return n;
    }

    private static Map<String, Notification> roots(Notification... notifications) {
        Map<String, Notification> roots = new LinkedHashMap<>();
        for (Notification n : notifications) {
            roots.put(n.getName(), n);
        }
        return roots;
    }

    @Test
    void chain_ends_at_notification_without_next() {
        var a = notification("A", "B");
        notification("B", null);

        var chains = NotificationChains.build(registry::get, roots(a));

        assertThat(chains).containsExactly(List.of("A", "B"));
    }

    @Test
    void two_node_loop_is_marked_from_each_root() {
        var a = notification("A", "B");
        var b = notification("B", "A");

        var chains = NotificationChains.build(registry::get, roots(a, b));

        assertThat(chains).containsExactlyInAnyOrder(
                List.of("A", "B", "...A"),
                List.of("B", "A", "...B"));
    }

    @Test
    void self_reference_is_a_loop() {
        var a = notification("A", "A");

        var chains = NotificationChains.build(registry::get, roots(a));

        assertThat(chains).containsExactly(List.of("A", "...A"));
    }

    @Test
    void loop_back_to_ancestor_in_the_middle() {
        var a = notification("A", "B");
        notification("B", "C");
        notification("C", "B");

        var chains = NotificationChains.build(registry::get, roots(a));

        assertThat(chains).containsExactly(List.of("A", "B", "C", "...B"));
    }

    @Test
    void shared_next_produces_one_chain_per_root() {
        var a = notification("A", "C");
        var b = notification("B", "C");
        notification("C", null);

        var chains = NotificationChains.build(registry::get, roots(a, b));

        assertThat(chains).containsExactlyInAnyOrder(List.of("A", "C"), List.of("B", "C"));
    }

    @Test
    void empty_input_yields_no_chains() {
        assertThat(NotificationChains.build(registry::get, Map.of())).isEmpty();
    }
}
