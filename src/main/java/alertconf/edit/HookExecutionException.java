package alertconf.edit;

import alertconf.rule.RuleConfException;
import lombok.Getter;

/**
 * 保存钩子启动失败、超时或返回非零退出码
 */
@Getter
public class HookExecutionException extends RuleConfException {
    private final String stderr;

    public HookExecutionException(String message, String stderr) {
        super(stderr == null || stderr.isBlank() ? message : message + ": " + stderr.trim());
        this.stderr = stderr;
    }

    public HookExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.stderr = null;
    }
}
