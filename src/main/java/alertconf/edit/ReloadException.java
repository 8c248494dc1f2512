package alertconf.edit;

import alertconf.rule.RuleConfException;

/**
 * 文本已保存, 但按新文本重建配置失败
 */
public class ReloadException extends RuleConfException {
    public ReloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
