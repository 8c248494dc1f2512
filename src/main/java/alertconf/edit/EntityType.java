package alertconf.edit;

import alertconf.rule.RuleConfParser;
import alertconf.rule.RuleValidationException;

import java.util.Locale;

/**
 * 可编辑的实体类型及其在规则文本中的配置段
 */
public enum EntityType {
    ALERT(RuleConfParser.SECTION_ALERTS),
    NOTIFICATION(RuleConfParser.SECTION_NOTIFICATIONS),
    TEMPLATE(RuleConfParser.SECTION_TEMPLATES),
    LOOKUP(RuleConfParser.SECTION_LOOKUPS),
    MACRO(RuleConfParser.SECTION_MACROS);

    private final String section;

    EntityType(String section) {
        this.section = section;
    }

    public String getSection() {
        return section;
    }

    public static EntityType fromString(String type) {
        if (type == null) {
            throw new RuleValidationException("编辑请求缺少实体类型");
        }
        try {
            return valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuleValidationException("不支持的实体类型: " + type, e);
        }
    }
}
