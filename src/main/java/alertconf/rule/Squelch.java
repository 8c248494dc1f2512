package alertconf.rule;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * 单条抑制规则: tag key -> 正则. 规则内所有 key 都必须存在且匹配
 */
public final class Squelch {
    private final ImmutableMap<String, Pattern> patterns;

    Squelch(Map<String, Pattern> patterns) {
        this.patterns = ImmutableMap.copyOf(patterns);
    }

    /**
     * 空规则永不匹配; 匹配采用子串搜索语义, 需要整串匹配时由正则自行锚定
     */
    public boolean squelched(TagSet tags) {
        if (patterns.isEmpty()) {
            return false;
        }
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            String value = tags.get(entry.getKey());
            if (value == null || !entry.getValue().matcher(value).find()) {
                return false;
            }
        }
        return true;
    }

    public Map<String, Pattern> getPatterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return patterns.toString();
    }
}
