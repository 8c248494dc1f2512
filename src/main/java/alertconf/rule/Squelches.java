package alertconf.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 抑制规则列表, 任意一条匹配即抑制
 */
public class Squelches {
    private final List<Squelch> squelches = new CopyOnWriteArrayList<>();

    /**
     * 解析 key=regex,... 表达式并追加一条规则. 任一正则编译失败时不追加
     *
     * @throws TagParseException     表达式格式错误
     * @throws SquelchRegexException 正则无效
     */
    void add(String tagExpr) {
        Map<String, String> tags = TagParser.parse(tagExpr);
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            try {
                patterns.put(tag.getKey(), Pattern.compile(tag.getValue()));
            } catch (PatternSyntaxException e) {
                throw new SquelchRegexException(tag.getKey(), e);
            }
        }
        squelches.add(new Squelch(patterns));
    }

    public boolean squelched(TagSet tags) {
        for (Squelch squelch : squelches) {
            if (squelch.squelched(tags)) {
                return true;
            }
        }
        return false;
    }

    public List<Squelch> asList() {
        return Collections.unmodifiableList(squelches);
    }

    public int size() {
        return squelches.size();
    }

    public boolean isEmpty() {
        return squelches.isEmpty();
    }
}
