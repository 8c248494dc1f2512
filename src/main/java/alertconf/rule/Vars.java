package alertconf.rule;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * $name / ${name} 变量展开
 */
public final class Vars {
    private static final Pattern VAR_PATTERN = Pattern.compile("\\$\\{([A-Za-z0-9_]+)}|\\$([A-Za-z0-9_]+)");

    private Vars() {
    }

    /**
     * 先查局部变量, 再查全局变量.
     *
     * @param ignoreBadExpand 为 true 时未定义的变量原样保留, 否则抛出 {@link RuleValidationException}
     */
    public static String expand(String text, Map<String, String> local, Map<String, String> global,
                                boolean ignoreBadExpand) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }
        Matcher m = VAR_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            String value = local.containsKey(name) ? local.get(name) : global.get(name);
            if (value == null) {
                if (!ignoreBadExpand) {
                    throw new RuleValidationException("未定义的变量: $" + name);
                }
                value = m.group();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
