package alertconf.rule;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 规则文本解析器 - 把 YAML 规则文本解析为 {@link RuleConf} 快照
 */
@Slf4j
public class RuleConfParser {

    public static final String SECTION_VARS = "vars";
    public static final String SECTION_SQUELCH = "squelch";
    public static final String SECTION_TEMPLATES = "templates";
    public static final String SECTION_MACROS = "macros";
    public static final String SECTION_LOOKUPS = "lookups";
    public static final String SECTION_NOTIFICATIONS = "notifications";
    public static final String SECTION_ALERTS = "alerts";

    private static final Set<String> SECTIONS = ImmutableSet.of(SECTION_VARS, SECTION_SQUELCH, SECTION_TEMPLATES,
            SECTION_MACROS, SECTION_LOOKUPS, SECTION_NOTIFICATIONS, SECTION_ALERTS);

    private static final Set<String> TEMPLATE_KEYS = ImmutableSet.of("subject", "body");
    private static final Set<String> MACRO_KEYS = ImmutableSet.of("pairs");
    private static final Set<String> LOOKUP_KEYS = ImmutableSet.of("tags", "entries");
    private static final Set<String> ENTRY_KEYS = ImmutableSet.of("def", "values");
    private static final Set<String> NOTIFICATION_KEYS = ImmutableSet.of("email", "post", "get", "body", "print",
            "next", "timeout", "contentType", "runOnActions", "useBody", "vars");
    private static final Set<String> ALERT_KEYS = ImmutableSet.of("template", "crit", "warn", "depends",
            "critNotification", "warnNotification", "squelch", "unknown", "maxLogFrequency", "ignoreUnknown",
            "unknownsNormal", "unjoinedOk", "log", "runEvery", "vars", "macro");

    private static final Pattern LOOKUP_REF =
            Pattern.compile("lookup\\(\\s*\"?([\\w.-]+)\"?\\s*(?:,\\s*\"?([\\w.-]+)\"?\\s*)?\\)");
    private static final Pattern EMAIL = Pattern.compile("[^@\\s<>]+@[^@\\s<>]+");
    private static final Splitter COMMA_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final YAMLFactory yamlFactory;
    private final ObjectMapper yamlMapper;

    public RuleConfParser() {
        this.yamlFactory = YAMLFactory.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .build();
        this.yamlMapper = new ObjectMapper(yamlFactory)
                .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
    }

    /**
     * 解析完整规则文本
     *
     * @throws RuleValidationException 文本不是合法 YAML 或任一实体校验失败
     */
    public RuleConf parse(String text) {
        ObjectNode root = readTree(text);
        for (Iterator<String> it = root.fieldNames(); it.hasNext(); ) {
            String section = it.next();
            if (!SECTIONS.contains(section)) {
                throw new RuleValidationException("未知的配置段: " + section);
            }
        }
        Map<String, Locator> locators = locate(text);

        Map<String, String> vars = stringMap(root.get(SECTION_VARS), SECTION_VARS);

        Squelches squelch = new Squelches();
        for (String expr : textList(root.get(SECTION_SQUELCH))) {
            try {
                squelch.add(expr);
            } catch (TagParseException | SquelchRegexException e) {
                throw new RuleValidationException("全局抑制规则无效: " + e.getMessage(), e);
            }
        }

        Map<String, Template> templates = new LinkedHashMap<>();
        for (Map.Entry<String, ObjectNode> e : entities(root, SECTION_TEMPLATES)) {
            templates.put(e.getKey(), parseTemplate(e.getKey(), e.getValue(), locators));
        }

        Map<String, Macro> macros = new LinkedHashMap<>();
        for (Map.Entry<String, ObjectNode> e : entities(root, SECTION_MACROS)) {
            macros.put(e.getKey(), parseMacro(e.getKey(), e.getValue(), locators));
        }

        Map<String, Lookup> lookups = new LinkedHashMap<>();
        for (Map.Entry<String, ObjectNode> e : entities(root, SECTION_LOOKUPS)) {
            lookups.put(e.getKey(), parseLookup(e.getKey(), e.getValue(), locators));
        }

        Map<String, Notification> notifications = new LinkedHashMap<>();
        for (Map.Entry<String, ObjectNode> e : entities(root, SECTION_NOTIFICATIONS)) {
            notifications.put(e.getKey(), parseNotification(e.getKey(), e.getValue(), locators));
        }
        for (Notification n : notifications.values()) {
            if (n.hasNext() && !notifications.containsKey(n.getNextName())) {
                throw new RuleValidationException(String.format("通知 %s 的 next 不存在: %s",
                        n.getName(), n.getNextName()));
            }
        }

        Map<String, Alert> alerts = new LinkedHashMap<>();
        for (Map.Entry<String, ObjectNode> e : entities(root, SECTION_ALERTS)) {
            alerts.put(e.getKey(), parseAlert(e.getKey(), e.getValue(), locators, vars, templates, macros,
                    lookups, notifications));
        }

        log.debug("规则解析完成: alerts={}, notifications={}, lookups={}, templates={}, macros={}",
                alerts.size(), notifications.size(), lookups.size(), templates.size(), macros.size());

        return RuleConf.builder()
                .rawText(text)
                .vars(vars)
                .squelch(squelch)
                .templates(templates)
                .macros(macros)
                .lookups(lookups)
                .notifications(notifications)
                .alerts(alerts)
                .build();
    }

    /**
     * 读取规则文本为可编辑的树, 空文本返回空对象
     */
    public ObjectNode readTree(String text) {
        if (StringUtils.isBlank(text)) {
            return yamlMapper.createObjectNode();
        }
        JsonNode root;
        try {
            root = yamlMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new RuleValidationException("规则文本不是合法的 YAML: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return yamlMapper.createObjectNode();
        }
        if (!root.isObject()) {
            throw new RuleValidationException("规则文本顶层必须是映射");
        }
        return (ObjectNode) root;
    }

    /**
     * 读取单个实体的定义文本, 必须是映射
     */
    public ObjectNode readEntity(String text) {
        if (StringUtils.isBlank(text)) {
            throw new RuleValidationException("实体定义不能为空");
        }
        JsonNode node;
        try {
            node = yamlMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new RuleValidationException("实体定义不是合法的 YAML: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new RuleValidationException("实体定义必须是映射");
        }
        return (ObjectNode) node;
    }

    public String write(JsonNode node) {
        try {
            return yamlMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new RuleConfException("序列化规则文本失败", e);
        }
    }

    // ===== 实体解析 =====

    private Template parseTemplate(String name, ObjectNode body, Map<String, Locator> locators) {
        checkKeys(body, TEMPLATE_KEYS, "模板", name);
        return Template.builder()
                .name(name)
                .text(write(body))
                .subject(text(body, "subject", "模板", name))
                .body(text(body, "body", "模板", name))
                .locator(locators.get(SECTION_TEMPLATES + "/" + name))
                .build();
    }

    private Macro parseMacro(String name, ObjectNode body, Map<String, Locator> locators) {
        checkKeys(body, MACRO_KEYS, "宏", name);
        Macro.MacroBuilder builder = Macro.builder()
                .name(name)
                .text(write(body))
                .locator(locators.get(SECTION_MACROS + "/" + name));
        stringMap(body.get("pairs"), "宏 " + name + " 的 pairs")
                .forEach((k, v) -> builder.pair(new Macro.Pair(k, v)));
        return builder.build();
    }

    private Lookup parseLookup(String name, ObjectNode body, Map<String, Locator> locators) {
        checkKeys(body, LOOKUP_KEYS, "查找表", name);
        List<String> tags = commaList(body.get("tags"));
        if (tags.isEmpty()) {
            throw new RuleValidationException("查找表 " + name + " 必须声明 tags");
        }
        Lookup.LookupBuilder builder = Lookup.builder()
                .name(name)
                .text(write(body))
                .tags(tags)
                .locator(locators.get(SECTION_LOOKUPS + "/" + name));

        JsonNode entries = body.get("entries");
        if (entries != null && !entries.isNull()) {
            if (!entries.isArray()) {
                throw new RuleValidationException("查找表 " + name + " 的 entries 必须是列表");
            }
            for (JsonNode entryNode : entries) {
                builder.entry(parseEntry(name, tags, entryNode));
            }
        }
        return builder.build();
    }

    private Lookup.Entry parseEntry(String lookupName, List<String> tags, JsonNode node) {
        if (!node.isObject()) {
            throw new RuleValidationException("查找表 " + lookupName + " 的条目必须是映射");
        }
        ObjectNode entry = (ObjectNode) node;
        checkKeys(entry, ENTRY_KEYS, "查找表条目", lookupName);
        String def = text(entry, "def", "查找表条目", lookupName);
        if (def == null) {
            throw new RuleValidationException("查找表 " + lookupName + " 的条目缺少 def");
        }
        Map<String, String> resolved;
        try {
            resolved = TagParser.parse(def);
        } catch (TagParseException e) {
            throw new RuleValidationException(String.format("查找表 %s 的条目 %s 无效: %s",
                    lookupName, def, e.getMessage()), e);
        }
        for (String key : resolved.keySet()) {
            if (!tags.contains(key)) {
                throw new RuleValidationException(String.format("查找表 %s 的条目 %s 使用了未声明的标签: %s",
                        lookupName, def, key));
            }
        }
        Map<String, String> values = stringMap(entry.get("values"), "查找表 " + lookupName + " 的 values");
        for (Map.Entry<String, String> value : values.entrySet()) {
            if (resolved.containsKey(value.getKey())) {
                throw new RuleValidationException(String.format("查找表 %s 的条目 %s 的值与标签重名: %s",
                        lookupName, def, value.getKey()));
            }
            resolved.put(value.getKey(), value.getValue());
        }
        return new Lookup.Entry(def, resolved);
    }

    private Notification parseNotification(String name, ObjectNode body, Map<String, Locator> locators) {
        checkKeys(body, NOTIFICATION_KEYS, "通知", name);
        List<String> email = commaList(body.get("email"));
        for (String address : email) {
            if (!EMAIL.matcher(address).matches()) {
                throw new RuleValidationException(String.format("通知 %s 的邮箱地址无效: %s", name, address));
            }
        }
        String next = text(body, "next", "通知", name);
        Duration timeout = duration(body, "timeout", "通知", name);
        if (timeout != null && next == null) {
            throw new RuleValidationException("通知 " + name + " 配置了 timeout 但没有 next");
        }
        return Notification.builder()
                .name(name)
                .text(write(body))
                .vars(stringMap(body.get("vars"), "通知 " + name + " 的 vars"))
                .email(email)
                .post(url(body, "post", name))
                .get(url(body, "get", name))
                .body(text(body, "body", "通知", name))
                .print(bool(body, "print", false, "通知", name))
                .nextName(next)
                .timeout(timeout)
                .contentType(text(body, "contentType", "通知", name))
                .runOnActions(bool(body, "runOnActions", true, "通知", name))
                .useBody(bool(body, "useBody", false, "通知", name))
                .locator(locators.get(SECTION_NOTIFICATIONS + "/" + name))
                .build();
    }

    private Alert parseAlert(String name, ObjectNode original, Map<String, Locator> locators,
                             Map<String, String> globalVars,
                             Map<String, Template> templates,
                             Map<String, Macro> macros,
                             Map<String, Lookup> lookups,
                             Map<String, Notification> notifications) {
        ObjectNode body = original.deepCopy();
        List<String> macroNames = commaList(body.remove("macro"));
        for (String macroName : macroNames) {
            Macro macro = macros.get(macroName);
            if (macro == null) {
                throw new RuleValidationException(String.format("告警 %s 引用的宏不存在: %s", name, macroName));
            }
            for (Macro.Pair pair : macro.getPairs()) {
                if (!"macro".equals(pair.key()) && !body.has(pair.key())) {
                    body.put(pair.key(), pair.value());
                }
            }
        }
        checkKeys(body, ALERT_KEYS, "告警", name);

        Map<String, String> vars = stringMap(body.get("vars"), "告警 " + name + " 的 vars");
        String crit = expand(text(body, "crit", "告警", name), vars, globalVars, name);
        String warn = expand(text(body, "warn", "告警", name), vars, globalVars, name);
        if (crit == null && warn == null) {
            throw new RuleValidationException("告警 " + name + " 必须配置 crit 或 warn");
        }

        String templateName = text(body, "template", "告警", name);
        if (templateName != null && !templates.containsKey(templateName)) {
            throw new RuleValidationException(String.format("告警 %s 引用的模板不存在: %s", name, templateName));
        }

        Squelches squelch = new Squelches();
        for (String expr : textList(body.get("squelch"))) {
            try {
                squelch.add(expr);
            } catch (TagParseException | SquelchRegexException e) {
                throw new RuleValidationException(String.format("告警 %s 的抑制规则无效: %s", name, e.getMessage()), e);
            }
        }

        int runEvery = integer(body, "runEvery", 1, name);
        if (runEvery <= 0) {
            throw new RuleValidationException("告警 " + name + " 的 runEvery 必须大于 0");
        }

        return Alert.builder()
                .name(name)
                .text(write(original))
                .vars(vars)
                .templateName(templateName)
                .crit(crit)
                .warn(warn)
                .depends(expand(text(body, "depends", "告警", name), vars, globalVars, name))
                .squelch(squelch)
                .critNotification(parseNotifications(body.get("critNotification"), name, lookups, notifications))
                .warnNotification(parseNotifications(body.get("warnNotification"), name, lookups, notifications))
                .macros(macroNames)
                .unknown(duration(body, "unknown", "告警", name))
                .maxLogFrequency(duration(body, "maxLogFrequency", "告警", name))
                .ignoreUnknown(bool(body, "ignoreUnknown", false, "告警", name))
                .unknownsNormal(bool(body, "unknownsNormal", false, "告警", name))
                .unjoinedOk(bool(body, "unjoinedOk", false, "告警", name))
                .log(bool(body, "log", false, "告警", name))
                .runEvery(runEvery)
                .locator(locators.get(SECTION_ALERTS + "/" + name))
                .build();
    }

    /**
     * 通知引用: 通知名, 或 lookup(表名) / lookup(表名, 键). 省略键时用表名作为键
     */
    private Notifications parseNotifications(JsonNode node, String alertName,
                                             Map<String, Lookup> lookups,
                                             Map<String, Notification> notifications) {
        Map<String, Notification> statics = new LinkedHashMap<>();
        Map<String, Lookup> byKey = new LinkedHashMap<>();
        for (String item : notificationItems(node)) {
            Matcher m = LOOKUP_REF.matcher(item);
            if (m.matches()) {
                String table = m.group(1);
                String key = m.group(2) != null ? m.group(2) : table;
                Lookup lookup = lookups.get(table);
                if (lookup == null) {
                    throw new RuleValidationException(String.format("告警 %s 引用的查找表不存在: %s", alertName, table));
                }
                byKey.put(key, lookup);
                continue;
            }
            Notification n = notifications.get(item);
            if (n == null) {
                throw new RuleValidationException(String.format("告警 %s 引用的通知不存在: %s", alertName, item));
            }
            statics.put(item, n);
        }
        return new Notifications(statics, byKey);
    }

    // ===== 位置信息 =====

    /**
     * 每个实体 "段/名称" 的行区间
     */
    private Map<String, Locator> locate(String text) {
        Map<String, Locator> locators = new HashMap<>();
        for (RuleTextLayout.Section section : layout(text).getSections().values()) {
            for (RuleTextLayout.Entity entity : section.entities()) {
                locators.put(section.name() + "/" + entity.name(), entity.locator());
            }
        }
        return locators;
    }

    /**
     * 扫描 YAML token 流, 得到顶层配置段和实体的行布局. 只要求文本是合法 YAML, 不做规则校验
     *
     * @throws RuleValidationException 文本不是合法的 YAML
     */
    public RuleTextLayout layout(String text) {
        List<String> lines = StringUtils.isEmpty(text) ? List.of() : RuleTextLayout.splitLines(text);
        Map<String, RuleTextLayout.Section> sections = new LinkedHashMap<>();
        if (StringUtils.isBlank(text)) {
            return new RuleTextLayout(lines, sections);
        }

        List<ScannedSection> scanned = new ArrayList<>();
        try (JsonParser p = yamlFactory.createParser(text)) {
            if (p.nextToken() != JsonToken.START_OBJECT) {
                return new RuleTextLayout(lines, sections);
            }
            while (p.nextToken() == JsonToken.FIELD_NAME) {
                ScannedSection section = new ScannedSection(p.currentName(), p.getTokenLocation().getLineNr());
                if (p.nextToken() == JsonToken.START_OBJECT) {
                    section.object = true;
                    while (p.nextToken() == JsonToken.FIELD_NAME) {
                        section.names.add(p.currentName());
                        section.starts.add(p.getTokenLocation().getLineNr());
                        p.nextToken();
                        p.skipChildren();
                    }
                } else {
                    p.skipChildren();
                }
                scanned.add(section);
            }
        } catch (IOException e) {
            throw new RuleValidationException("规则文本不是合法的 YAML: " + e.getMessage(), e);
        }

        for (int i = 0; i < scanned.size(); i++) {
            ScannedSection s = scanned.get(i);
            int bound = i + 1 < scanned.size() ? scanned.get(i + 1).keyLine - 1 : lines.size();
            boolean block = s.object;
            int previousStart = s.keyLine;
            List<RuleTextLayout.Entity> entities = new ArrayList<>();
            for (int j = 0; j < s.names.size(); j++) {
                int start = s.starts.get(j);
                if (start <= previousStart) {
                    block = false;
                }
                previousStart = start;
                int entityBound = j + 1 < s.names.size() ? s.starts.get(j + 1) - 1 : bound;
                int end = RuleTextLayout.lastContentLine(lines, start, entityBound);
                entities.add(new RuleTextLayout.Entity(s.names.get(j), Locator.nativeLines(start, end)));
            }
            int sectionEnd = RuleTextLayout.lastContentLine(lines, s.keyLine, bound);
            sections.put(s.name,
                    new RuleTextLayout.Section(s.name, s.keyLine, sectionEnd, block, List.copyOf(entities)));
        }
        return new RuleTextLayout(lines, sections);
    }

    private static final class ScannedSection {
        private final String name;
        private final int keyLine;
        private final List<String> names = new ArrayList<>();
        private final List<Integer> starts = new ArrayList<>();
        private boolean object;

        private ScannedSection(String name, int keyLine) {
            this.name = name;
            this.keyLine = keyLine;
        }
    }

    // ===== 工具方法 =====

    private List<Map.Entry<String, ObjectNode>> entities(ObjectNode root, String section) {
        JsonNode node = root.get(section);
        if (node == null || node.isNull()) {
            return Collections.emptyList();
        }
        if (!node.isObject()) {
            throw new RuleValidationException("配置段 " + section + " 必须是映射");
        }
        List<Map.Entry<String, ObjectNode>> result = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isObject()) {
                throw new RuleValidationException(String.format("%s 中的 %s 必须是映射", section, e.getKey()));
            }
            result.add(Map.entry(e.getKey(), (ObjectNode) e.getValue()));
        }
        return result;
    }

    private static void checkKeys(ObjectNode body, Set<String> allowed, String kind, String name) {
        for (Iterator<String> it = body.fieldNames(); it.hasNext(); ) {
            String key = it.next();
            if (!allowed.contains(key)) {
                throw new RuleValidationException(String.format("%s %s 包含未知配置项: %s", kind, name, key));
            }
        }
    }

    private static String text(ObjectNode body, String key, String kind, String name) {
        JsonNode node = body.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new RuleValidationException(String.format("%s %s 的 %s 必须是标量", kind, name, key));
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static boolean bool(ObjectNode body, String key, boolean defaultValue, String kind, String name) {
        JsonNode node = body.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            String value = node.textValue().trim();
            if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
                return Boolean.parseBoolean(value);
            }
        }
        throw new RuleValidationException(String.format("%s %s 的 %s 必须是布尔值", kind, name, key));
    }

    private static int integer(ObjectNode body, String key, int defaultValue, String name) {
        JsonNode node = body.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new RuleValidationException(String.format("告警 %s 的 %s 必须是整数", name, key), e);
            }
        }
        throw new RuleValidationException(String.format("告警 %s 的 %s 必须是整数", name, key));
    }

    private static Duration duration(ObjectNode body, String key, String kind, String name) {
        String value = text(body, key, kind, name);
        if (value == null) {
            return null;
        }
        try {
            return parseDuration(value);
        } catch (RuleValidationException e) {
            throw new RuleValidationException(String.format("%s %s 的 %s 无效: %s", kind, name, key, e.getMessage()), e);
        }
    }

    /**
     * 解析时间周期字符串, 如 "30s", "5m", "1h", "1d"
     */
    public static Duration parseDuration(String value) {
        if (value == null) {
            throw new RuleValidationException("时间周期不能为空");
        }
        String number = value.replaceAll("[^0-9]", "");
        String unit = value.replaceAll("[0-9]", "").trim();
        if (number.isEmpty()) {
            throw new RuleValidationException("无效的时间周期格式: " + value);
        }
        try {
            long amount = Long.parseLong(number);
            switch (unit.toLowerCase()) {
                case "s":
                    return Duration.ofSeconds(amount);
                case "m":
                    return Duration.ofMinutes(amount);
                case "h":
                    return Duration.ofHours(amount);
                case "d":
                    return Duration.ofDays(amount);
                default:
                    throw new RuleValidationException("无效的时间单位: " + unit);
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw new RuleValidationException("时间周期超出范围: " + value, e);
        }
    }

    private static URI url(ObjectNode body, String key, String name) {
        String value = text(body, key, "通知", name);
        if (value == null) {
            return null;
        }
        try {
            URI uri = URI.create(value);
            if (uri.getHost() == null
                    || !("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))) {
                throw new RuleValidationException(String.format("通知 %s 的 %s 不是有效的 http(s) 地址: %s",
                        name, key, value));
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new RuleValidationException(String.format("通知 %s 的 %s 无效: %s", name, key, value), e);
        }
    }

    private static String expand(String text, Map<String, String> local, Map<String, String> global,
                                 String alertName) {
        try {
            return Vars.expand(text, local, global, false);
        } catch (RuleValidationException e) {
            throw new RuleValidationException("告警 " + alertName + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, String> stringMap(JsonNode node, String what) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isObject()) {
            throw new RuleValidationException(what + " 必须是映射");
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isValueNode()) {
                throw new RuleValidationException(what + " 中的 " + e.getKey() + " 必须是标量");
            }
            result.put(e.getKey(), e.getValue().asText());
        }
        return result;
    }

    /**
     * 单个字符串或字符串列表, 不按逗号拆分
     */
    private static List<String> textList(JsonNode node) {
        List<String> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                result.add(item.asText().trim());
            }
        } else if (node.isValueNode()) {
            result.add(node.asText().trim());
        } else {
            throw new RuleValidationException("期望字符串或字符串列表: " + node);
        }
        return result;
    }

    /**
     * 逗号分隔的字符串或字符串列表
     */
    private static List<String> commaList(JsonNode node) {
        List<String> result = new ArrayList<>();
        for (String item : textList(node)) {
            COMMA_SPLITTER.split(item).forEach(result::add);
        }
        return result;
    }

    /**
     * 按括号外的逗号拆分, lookup(表, 键) 中的逗号不拆
     */
    private static List<String> notificationItems(JsonNode node) {
        List<String> result = new ArrayList<>();
        for (String item : textList(node)) {
            int depth = 0;
            int start = 0;
            for (int i = 0; i < item.length(); i++) {
                char c = item.charAt(i);
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                } else if (c == ',' && depth == 0) {
                    addTrimmed(result, item.substring(start, i));
                    start = i + 1;
                }
            }
            addTrimmed(result, item.substring(start));
        }
        return result;
    }

    private static void addTrimmed(List<String> list, String value) {
        String trimmed = value.trim();
        if (!trimmed.isEmpty()) {
            list.add(trimmed);
        }
    }
}
