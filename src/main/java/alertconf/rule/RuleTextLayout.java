package alertconf.rule;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 规则文本的行布局: 每个顶层配置段及其实体所占的行区间.
 * 实体区间从名称所在行开始, 到下一个实体或配置段之前的最后一个非空、非注释行结束
 */
public final class RuleTextLayout {

    /**
     * 配置段中的一个实体
     */
    public record Entity(String name, Locator locator) {
    }

    /**
     * 顶层配置段. block 为 false 时实体写在段名同一行(flow 风格)或段的值不是映射
     */
    public record Section(String name, int keyLine, int endLine, boolean block, List<Entity> entities) {

        public Optional<Entity> entity(String entityName) {
            return entities.stream().filter(e -> e.name().equals(entityName)).findFirst();
        }
    }

    private final ImmutableList<String> lines;
    private final ImmutableMap<String, Section> sections;

    RuleTextLayout(List<String> lines, Map<String, Section> sections) {
        this.lines = ImmutableList.copyOf(lines);
        this.sections = ImmutableMap.copyOf(sections);
    }

    /**
     * 按 '\n' 切分, 以换行结尾时最后一个元素为空串, 用 '\n' 拼回即得到原文
     */
    public static List<String> splitLines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }

    public List<String> getLines() {
        return lines;
    }

    public Optional<Section> section(String name) {
        return Optional.ofNullable(sections.get(name));
    }

    public Map<String, Section> getSections() {
        return sections;
    }

    public static boolean isBlankOrComment(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty() || trimmed.startsWith("#");
    }

    /**
     * 从 bound 向上跳过空行和注释行, 不越过 floor
     */
    static int lastContentLine(List<String> lines, int floor, int bound) {
        int end = Math.min(bound, lines.size());
        while (end > floor && isBlankOrComment(lines.get(end - 1))) {
            end--;
        }
        return end;
    }
}
