package alertconf.rule;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 告警的一组通知: 静态声明的通知 + 按查找表动态选取的通知
 */
@Slf4j
public class Notifications {
    private static final Splitter NAME_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final ImmutableMap<String, Notification> notifications;
    // 值的 key -> 查找表
    private final ImmutableMap<String, Lookup> lookups;

    public Notifications(Map<String, Notification> notifications, Map<String, Lookup> lookups) {
        this.notifications = ImmutableMap.copyOf(notifications);
        this.lookups = ImmutableMap.copyOf(lookups);
    }

    public static Notifications empty() {
        return new Notifications(Map.of(), Map.of());
    }

    /**
     * 根据标签计算本次触发实际生效的通知.
     * 查找表给出的同名通知覆盖静态声明; 未知的通知名直接跳过
     */
    public Map<String, Notification> get(NotificationRegistry registry, TagSet tags) {
        Map<String, Notification> result = new LinkedHashMap<>(notifications);
        for (Map.Entry<String, Lookup> entry : lookups.entrySet()) {
            Optional<String> value = entry.getValue().get(entry.getKey(), tags);
            if (value.isEmpty()) {
                continue;
            }
            for (String name : NAME_SPLITTER.split(value.get())) {
                Notification n = registry.getNotification(name);
                if (n == null) {
                    log.debug("查找表 {} 引用了不存在的通知: {}", entry.getValue().getName(), name);
                    continue;
                }
                result.put(name, n);
            }
        }
        return result;
    }

    public Map<String, Notification> getNotifications() {
        return notifications;
    }

    public Map<String, Lookup> getLookups() {
        return lookups;
    }

    public boolean isEmpty() {
        return notifications.isEmpty() && lookups.isEmpty();
    }
}
