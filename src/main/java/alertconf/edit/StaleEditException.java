package alertconf.edit;

import alertconf.rule.RuleConfException;

/**
 * 提交的 diff 与当前文本计算出的 diff 不一致, 说明编辑基于过期的文本
 */
public class StaleEditException extends RuleConfException {
    public StaleEditException(String message) {
        super(message);
    }
}
