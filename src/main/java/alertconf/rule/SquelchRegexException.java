package alertconf.rule;

import java.util.regex.PatternSyntaxException;

/**
 * 抑制规则中的正则表达式无效
 */
public class SquelchRegexException extends RuleConfException {
    public SquelchRegexException(String tagKey, PatternSyntaxException cause) {
        super(String.format("抑制规则正则无效, tag=%s: %s", tagKey, cause.getDescription()), cause);
    }
}
