package alertconf.rule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 通知升级链构建
 */
public final class NotificationChains {
    /**
     * 链路成环时追加的节点名前缀
     */
    public static final String LOOP_PREFIX = "...";

    private NotificationChains() {
    }

    /**
     * 以每个通知为起点沿 next 展开为一条链. 再次遇到已出现的通知时,
     * 追加 "...名称" 并结束该链
     */
    public static List<List<String>> build(NotificationRegistry registry, Map<String, Notification> roots) {
        List<List<String>> chains = new ArrayList<>();
        for (Notification root : roots.values()) {
            List<String> chain = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            Notification next = root;
            while (next != null) {
                if (!seen.add(next.getName())) {
                    chain.add(LOOP_PREFIX + next.getName());
                    break;
                }
                chain.add(next.getName());
                next = next.hasNext() ? registry.getNotification(next.getNextName()) : null;
            }
            chains.add(chain);
        }
        return chains;
    }
}
