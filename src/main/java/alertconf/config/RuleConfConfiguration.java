package alertconf.config;

import alertconf.edit.CommandSaveHook;
import alertconf.edit.RuleConfStore;
import alertconf.notify.AlertNotificationResolver;
import alertconf.rule.LiveRuleConf;
import alertconf.rule.RuleConfParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class RuleConfConfiguration {

    @Autowired
    private RuleConfPathManage ruleConfPathManage;

    @Bean
    public RuleConfSettings ruleConfSettings() {
        RuleConfSettings settings = RuleConfSettings.load(ruleConfPathManage.ruleConfConfigPath);
        settings.validate();
        return settings;
    }

    @Bean
    public RuleConfParser ruleConfParser() {
        return new RuleConfParser();
    }

    @Bean
    public LiveRuleConf liveRuleConf(RuleConfParser parser) {
        return new LiveRuleConf(parser);
    }

    @Bean
    public RuleConfStore ruleConfStore(RuleConfSettings settings, RuleConfParser parser, LiveRuleConf liveRuleConf) {
        RuleConfStore store = RuleConfStore.open(settings.getRuleFile(), parser);
        store.setReload(() -> liveRuleConf.rebuild(store.getRawText()));

        String hookCommand = settings.getHookCommand();
        if (hookCommand != null) {
            store.setSaveHook(CommandSaveHook.create(hookCommand, settings.getHookTimeout()));
        }

        // 启动时规则无效直接失败
        store.reload();
        log.info("规则配置已加载: file={}, hash={}", settings.getRuleFile(), store.getHash());
        return store;
    }

    @Bean
    public AlertNotificationResolver alertNotificationResolver(LiveRuleConf liveRuleConf) {
        return new AlertNotificationResolver(liveRuleConf);
    }
}
