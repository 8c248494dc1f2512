package alertconf.rule;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 告警定义. 每次重新解析规则文本时整体重建, 不在运行中逐字段修改
 */
@Getter
@Builder
@ToString(of = {"name", "templateName", "crit", "warn"})
public class Alert {
    private final String name;
    private final String text;
    @Builder.Default
    private final Map<String, String> vars = Map.of();
    private final String templateName;
    private final String crit;
    private final String warn;
    private final String depends;
    @Builder.Default
    private final Squelches squelch = new Squelches();
    @Builder.Default
    private final Notifications critNotification = Notifications.empty();
    @Builder.Default
    private final Notifications warnNotification = Notifications.empty();
    @Builder.Default
    private final List<String> macros = List.of();
    private final Duration unknown;
    private final Duration maxLogFrequency;
    private final boolean ignoreUnknown;
    private final boolean unknownsNormal;
    private final boolean unjoinedOk;
    private final boolean log;
    @Builder.Default
    private final int runEvery = 1;
    private final Locator locator;

    public Notifications getNotifications(Severity severity) {
        return severity == Severity.CRITICAL ? critNotification : warnNotification;
    }
}
