package alertconf.rule;

/**
 * 规则配置变更监听器接口
 */
public interface RuleConfChangeListener {
    void onReloaded(RuleConf previous, RuleConf current);

    void onReloadError(String hash, Exception error);
}
