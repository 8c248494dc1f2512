package alertconf.rule;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 告警实例的标签集合, 创建后不可变
 */
public final class TagSet {
    private static final TagSet EMPTY = new TagSet(ImmutableMap.of());

    private final ImmutableMap<String, String> tags;

    private TagSet(ImmutableMap<String, String> tags) {
        this.tags = tags;
    }

    public static TagSet empty() {
        return EMPTY;
    }

    public static TagSet of(Map<String, String> tags) {
        return new TagSet(ImmutableMap.copyOf(tags));
    }

    /**
     * 解析 key=value,key2=value2 形式的标签串
     */
    public static TagSet parse(String text) {
        return of(TagParser.parse(text));
    }

    public String get(String key) {
        return tags.get(key);
    }

    public boolean containsKey(String key) {
        return tags.containsKey(key);
    }

    public Set<String> keys() {
        return tags.keySet();
    }

    public Map<String, String> asMap() {
        return tags;
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TagSet)) {
            return false;
        }
        return tags.equals(((TagSet) o).tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tags);
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}
