package alertconf.rule;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * 宏: 一组有序键值对, 在告警解析前作为默认值合并进告警定义
 */
@Getter
@Builder
@ToString(of = {"name", "pairs"})
public class Macro {
    private final String name;
    private final String text;
    @Singular
    private final List<Pair> pairs;
    private final Locator locator;

    public record Pair(String key, String value) {
    }
}
