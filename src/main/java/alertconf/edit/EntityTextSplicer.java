package alertconf.edit;

import alertconf.rule.Locator;
import alertconf.rule.RuleConfParser;
import alertconf.rule.RuleTextLayout;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 按行替换规则文本中的单个实体. 实体以外的注释、空行和格式原样保留
 */
final class EntityTextSplicer {
    private static final int INDENT = 2;
    private static final Pattern PLAIN_KEY = Pattern.compile("[A-Za-z0-9_][-A-Za-z0-9_.]*");
    private static final Set<String> RESERVED_KEYS = ImmutableSet.of(
            "true", "false", "yes", "no", "on", "off", "null", "y", "n");

    private EntityTextSplicer() {
    }

    /**
     * 对文本应用一次编辑
     *
     * @return 编辑后的文本; 配置段不是逐行书写的映射(如 flow 风格)时返回 null
     */
    static String apply(RuleConfParser parser, String text, EntityType type, String name, EditRequest edit) {
        RuleTextLayout layout = parser.layout(text);
        List<String> lines = new ArrayList<>(layout.getLines());
        Optional<RuleTextLayout.Section> section = layout.section(type.getSection());

        if (edit.isDelete()) {
            return section.map(s -> delete(lines, s, name)).orElse(null);
        }
        List<String> body = bodyLines(edit.getText());
        if (section.isEmpty()) {
            return append(text, type.getSection(), name, body);
        }
        RuleTextLayout.Section s = section.get();
        if (s.entities().isEmpty()) {
            return fillEmptySection(lines, s, name, body);
        }
        if (!s.block()) {
            return null;
        }
        Optional<RuleTextLayout.Entity> existing = s.entity(name);
        if (existing.isPresent()) {
            return replace(lines, existing.get(), body);
        }
        return insert(lines, s, name, body);
    }

    private static String delete(List<String> lines, RuleTextLayout.Section section, String name) {
        Optional<RuleTextLayout.Entity> entity = section.entity(name);
        if (!section.block() || entity.isEmpty()) {
            return null;
        }
        Locator.NativeLocation loc = entity.get().locator().getNativeLocation();
        // 删除段内最后一个实体时连同段名一起删除
        int from = section.entities().size() == 1 ? section.keyLine() : loc.startLine();
        lines.subList(from - 1, loc.endLine()).clear();
        return String.join("\n", lines);
    }

    private static String replace(List<String> lines, RuleTextLayout.Entity entity, List<String> body) {
        Locator.NativeLocation loc = entity.locator().getNativeLocation();
        String keyLine = lines.get(loc.startLine() - 1);
        int entityIndent = indentOf(keyLine);
        if (loc.startLine() == loc.endLine()) {
            // 值与名称写在同一行
            lines.subList(loc.startLine() - 1, loc.endLine()).clear();
            lines.addAll(loc.startLine() - 1,
                    entityLines(entityIndent, entityIndent + INDENT, entity.name(), body));
        } else {
            int bodyIndent = bodyIndent(lines, entity, entityIndent);
            lines.subList(loc.startLine(), loc.endLine()).clear();
            lines.addAll(loc.startLine(), indent(body, bodyIndent));
        }
        return String.join("\n", lines);
    }

    private static String insert(List<String> lines, RuleTextLayout.Section section, String name, List<String> body) {
        RuleTextLayout.Entity first = section.entities().get(0);
        RuleTextLayout.Entity last = section.entities().get(section.entities().size() - 1);
        int entityIndent = indentOf(lines.get(first.locator().getNativeLocation().startLine() - 1));
        int bodyIndent = bodyIndent(lines, first, entityIndent);
        lines.addAll(last.locator().getNativeLocation().endLine(), entityLines(entityIndent, bodyIndent, name, body));
        return String.join("\n", lines);
    }

    private static String fillEmptySection(List<String> lines, RuleTextLayout.Section section, String name,
                                           List<String> body) {
        lines.set(section.keyLine() - 1, section.name() + ":");
        lines.addAll(section.keyLine(), entityLines(INDENT, INDENT * 2, name, body));
        return String.join("\n", lines);
    }

    private static String append(String text, String section, String name, List<String> body) {
        StringBuilder sb = new StringBuilder(text);
        if (!text.isEmpty() && !text.endsWith("\n")) {
            sb.append('\n');
        }
        sb.append(section).append(":\n");
        for (String line : entityLines(INDENT, INDENT * 2, name, body)) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * 实体定义文本去掉首尾空行和文档标记后的各行
     */
    static List<String> bodyLines(String text) {
        List<String> lines = new ArrayList<>(RuleTextLayout.splitLines(text));
        while (!lines.isEmpty() && (lines.get(0).isBlank() || lines.get(0).trim().equals("---"))) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && (lines.get(lines.size() - 1).isBlank()
                || lines.get(lines.size() - 1).trim().equals("..."))) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static List<String> entityLines(int entityIndent, int bodyIndent, String name, List<String> body) {
        List<String> result = new ArrayList<>();
        result.add(StringUtils.repeat(' ', entityIndent) + formatKey(name) + ":");
        result.addAll(indent(body, bodyIndent));
        return result;
    }

    private static List<String> indent(List<String> body, int width) {
        String prefix = StringUtils.repeat(' ', width);
        List<String> result = new ArrayList<>(body.size());
        for (String line : body) {
            result.add(line.isBlank() ? "" : prefix + line);
        }
        return result;
    }

    private static int bodyIndent(List<String> lines, RuleTextLayout.Entity entity, int entityIndent) {
        Locator.NativeLocation loc = entity.locator().getNativeLocation();
        for (int lineNr = loc.startLine() + 1; lineNr <= loc.endLine(); lineNr++) {
            String line = lines.get(lineNr - 1);
            if (!RuleTextLayout.isBlankOrComment(line)) {
                return Math.max(indentOf(line), entityIndent + 1);
            }
        }
        return entityIndent + INDENT;
    }

    private static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && line.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    static String formatKey(String name) {
        if (PLAIN_KEY.matcher(name).matches() && !RESERVED_KEYS.contains(name.toLowerCase(Locale.ROOT))) {
            return name;
        }
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(name)) + "\"";
    }
}
