package alertconf.config;

import alertconf.rule.RuleConfParser;
import alertconf.rule.RuleValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * 系统配置 - 规则文件位置、保存钩子等
 */
public class RuleConfSettings {
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_HOOK_TIMEOUT = "60s";

    private final JsonNode root;

    private RuleConfSettings(JsonNode root) {
        this.root = root == null ? MissingNode.getInstance() : root;
    }

    /**
     * 加载配置文件
     */
    public static RuleConfSettings load(String configPath) {
        Path path = Paths.get(configPath).toAbsolutePath();
        try {
            return new RuleConfSettings(yamlMapper.readTree(path.toFile()));
        } catch (IOException e) {
            throw new IllegalStateException("加载配置文件失败: " + configPath, e);
        }
    }

    public static RuleConfSettings of(Map<String, Object> config) {
        return new RuleConfSettings(yamlMapper.valueToTree(config));
    }

    public Path getRuleFile() {
        return Paths.get(getString("rules.file"));
    }

    /**
     * 未配置时返回 null
     */
    public String getHookCommand() {
        return StringUtils.trimToNull(getString("hook.command"));
    }

    /**
     * 与规则文本中的时间周期格式相同, 如 "30s", "5m"
     */
    public Duration getHookTimeout() {
        String value = getString("hook.timeout", DEFAULT_HOOK_TIMEOUT).trim();
        try {
            return RuleConfParser.parseDuration(value);
        } catch (RuleValidationException e) {
            throw new IllegalArgumentException("hook.timeout 配置无效: " + e.getMessage(), e);
        }
    }

    public String getString(String key) {
        return getString(key, null);
    }

    /**
     * 按 a.b.c 形式查找标量配置, 缺失或不是标量时返回默认值
     */
    public String getString(String key, String defaultValue) {
        if (StringUtils.isEmpty(key)) {
            return defaultValue;
        }
        JsonNode node = root.at("/" + key.replace('.', '/'));
        return node.isValueNode() && !node.isNull() ? node.asText() : defaultValue;
    }

    /**
     * 验证配置
     */
    public void validate() {
        if (StringUtils.isBlank(getString("rules.file"))) {
            throw new IllegalArgumentException("规则文件未配置: rules.file");
        }
        getHookTimeout();
    }
}
