package alertconf.edit;

import alertconf.rule.RuleConfException;

/**
 * 保存钩子命令不存在
 */
public class HookNotFoundException extends RuleConfException {
    public HookNotFoundException(String command) {
        super(String.format("命令 %s 不存在, 无法创建保存钩子", command));
    }
}
