package alertconf.rule;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 通知动作. next 仅按名称引用下一级通知, 遍历时通过 {@link NotificationRegistry} 解析
 */
@Getter
@Builder
@ToString(of = {"name", "nextName"})
public class Notification {
    private final String name;
    private final String text;
    @Builder.Default
    private final Map<String, String> vars = Map.of();
    @Builder.Default
    private final List<String> email = List.of();
    private final URI post;
    private final URI get;
    private final String body;
    private final boolean print;
    private final String nextName;
    private final Duration timeout;
    private final String contentType;
    @Builder.Default
    private final boolean runOnActions = true;
    private final boolean useBody;
    private final Locator locator;

    public boolean hasNext() {
        return nextName != null;
    }
}
