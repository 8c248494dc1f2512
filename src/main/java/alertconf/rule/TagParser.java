package alertconf.rule;

import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 标签表达式解析: 逗号分隔的 key=value 列表
 * <p>
 * 值原样保留(可以是正则), 因此值中不能包含逗号.
 */
public final class TagParser {
    private static final Pattern KEY_PATTERN = Pattern.compile("[-_./a-zA-Z0-9\\p{L}]+");
    private static final Splitter PAIR_SPLITTER = Splitter.on(',');

    private TagParser() {
    }

    /**
     * 解析标签表达式, 空串返回空映射
     *
     * @throws TagParseException 格式错误、key 非法或 key 重复
     */
    public static Map<String, String> parse(String text) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (StringUtils.isBlank(text)) {
            return tags;
        }
        for (String pair : PAIR_SPLITTER.split(text)) {
            int eq = pair.indexOf('=');
            if (eq < 0) {
                throw new TagParseException("无效的标签: " + pair);
            }
            String key = pair.substring(0, eq).trim();
            String value = pair.substring(eq + 1).trim();
            if (!KEY_PATTERN.matcher(key).matches() || value.isEmpty()) {
                throw new TagParseException("无效的标签: " + pair);
            }
            if (tags.containsKey(key)) {
                throw new TagParseException("重复的标签: " + key);
            }
            tags.put(key, value);
        }
        return tags;
    }
}
