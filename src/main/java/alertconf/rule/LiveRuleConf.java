package alertconf.rule;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 当前生效的规则快照. 重建时先完整解析出新快照再整体替换, 读者不会看到半成品
 */
@Slf4j
public class LiveRuleConf {
    private final RuleConfParser parser;
    private final List<RuleConfChangeListener> changeListeners = new CopyOnWriteArrayList<>();
    private volatile RuleConf current = RuleConf.empty();

    public LiveRuleConf(RuleConfParser parser) {
        this.parser = parser;
    }

    public RuleConf get() {
        return current;
    }

    /**
     * 按文本重建快照. 解析失败时保留旧快照并抛出异常. 多个重建串行执行, 后开始的结果生效
     */
    public synchronized RuleConf rebuild(String text) {
        RuleConf next;
        try {
            next = parser.parse(text);
        } catch (RuleConfException e) {
            log.error("规则重建失败, 继续使用旧配置: hash={}", current.getHash(), e);
            notifyReloadError(RuleConf.genHash(text == null ? "" : text), e);
            throw e;
        }
        RuleConf previous = current;
        current = next;
        log.info("规则已重建: hash={}, alerts={}, notifications={}, lookups={}",
                next.getHash(), next.getAlerts().size(), next.getNotifications().size(), next.getLookups().size());
        notifyReloaded(previous, next);
        return next;
    }

    public void addChangeListener(RuleConfChangeListener listener) {
        changeListeners.add(listener);
    }

    public void removeChangeListener(RuleConfChangeListener listener) {
        changeListeners.remove(listener);
    }

    private void notifyReloaded(RuleConf previous, RuleConf next) {
        for (RuleConfChangeListener listener : changeListeners) {
            try {
                listener.onReloaded(previous, next);
            } catch (Exception e) {
                log.error("通知规则重建失败: " + listener, e);
            }
        }
    }

    private void notifyReloadError(String hash, Exception error) {
        for (RuleConfChangeListener listener : changeListeners) {
            try {
                listener.onReloadError(hash, error);
            } catch (Exception e) {
                log.error("通知规则重建错误失败: " + listener, e);
            }
        }
    }
}
