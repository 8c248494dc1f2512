package alertconf.rule;

/**
 * 规则文本无法解析为合法的配置
 */
public class RuleValidationException extends RuleConfException {
    public RuleValidationException(String message) {
        super(message);
    }

    public RuleValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
