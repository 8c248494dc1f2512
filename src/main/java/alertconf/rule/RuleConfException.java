package alertconf.rule;

/**
 * 规则配置异常 - 所有规则解析、校验、编辑相关异常的基类
 */
public class RuleConfException extends RuntimeException {
    public RuleConfException(String message) {
        super(message);
    }

    public RuleConfException(String message, Throwable cause) {
        super(message, cause);
    }
}
