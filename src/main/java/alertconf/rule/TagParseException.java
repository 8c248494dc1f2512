package alertconf.rule;

/**
 * 标签表达式格式错误
 */
public class TagParseException extends RuleConfException {
    public TagParseException(String message) {
        super(message);
    }
}
