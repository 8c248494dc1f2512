package alertconf.notify;

import alertconf.rule.Notification;
import alertconf.rule.Severity;
import alertconf.rule.TagSet;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * 一次告警触发的通知解析结果
 */
@Getter
@Builder
@ToString
public class Resolution {
    private final String alertName;
    private final Severity severity;
    private final TagSet tags;
    private final String confHash;
    private final boolean squelched;
    @Builder.Default
    private final Map<String, Notification> notifications = Map.of();
    @Builder.Default
    private final List<List<String>> chains = List.of();
}
