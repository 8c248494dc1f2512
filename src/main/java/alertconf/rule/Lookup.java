package alertconf.rule;

import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 查找表 - 按标签值选取一个字符串值
 */
@Getter
@Builder
@ToString(of = {"name", "tags"})
public class Lookup {
    private final String name;
    private final String text;
    @Singular
    private final List<String> tags;
    @Singular
    private final List<Entry> entries;
    private final Locator locator;

    /**
     * 按声明顺序查找第一条匹配的条目, 返回其上 key 对应的值.
     * 首条匹配即停止, 条目之间不合并
     */
    public Optional<String> get(String key, TagSet tagSet) {
        for (Entry entry : entries) {
            if (!entry.matches(tags, tagSet)) {
                continue;
            }
            return Optional.ofNullable(entry.getValues().get(key));
        }
        return Optional.empty();
    }

    /**
     * 查找表的一行: 原始定义 + 解析后的键值
     */
    @Getter
    @ToString
    public static class Entry {
        private final String def;
        private final ImmutableMap<String, String> values;

        public Entry(String def, Map<String, String> values) {
            this.def = def;
            this.values = ImmutableMap.copyOf(values);
        }

        boolean matches(List<String> lookupTags, TagSet tagSet) {
            for (String tagKey : lookupTags) {
                String expected = values.get(tagKey);
                if (expected == null || !expected.equals(tagSet.get(tagKey))) {
                    return false;
                }
            }
            return true;
        }
    }
}
