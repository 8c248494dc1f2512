package alertconf.notify;

import alertconf.rule.Alert;
import alertconf.rule.LiveRuleConf;
import alertconf.rule.Notification;
import alertconf.rule.NotificationChains;
import alertconf.rule.RuleConf;
import alertconf.rule.RuleConfException;
import alertconf.rule.Severity;
import alertconf.rule.TagSet;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 告警触发时的通知解析: 抑制判断 -> 选取通知 -> 展开升级链.
 * 整个过程只读取同一份规则快照
 */
@Slf4j
public class AlertNotificationResolver {
    private final LiveRuleConf liveRuleConf;

    public AlertNotificationResolver(LiveRuleConf liveRuleConf) {
        this.liveRuleConf = liveRuleConf;
    }

    public Resolution resolve(String alertName, Severity severity, TagSet tags) {
        RuleConf conf = liveRuleConf.get();
        Alert alert = conf.getAlert(alertName);
        if (alert == null) {
            throw new RuleConfException("告警不存在: " + alertName);
        }

        Resolution.ResolutionBuilder builder = Resolution.builder()
                .alertName(alertName)
                .severity(severity)
                .tags(tags)
                .confHash(conf.getHash());

        if (conf.squelched(alert, tags)) {
            log.debug("告警已被抑制: alert={}, tags={}", alertName, tags);
            return builder.squelched(true).build();
        }

        Map<String, Notification> notifications = alert.getNotifications(severity).get(conf, tags);
        return builder
                .squelched(false)
                .notifications(notifications)
                .chains(NotificationChains.build(conf, notifications))
                .build();
    }
}
