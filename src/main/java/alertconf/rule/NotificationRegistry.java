package alertconf.rule;

/**
 * 按名称查找通知的全局注册表
 */
@FunctionalInterface
public interface NotificationRegistry {
    /**
     * @return 对应通知, 不存在时返回 null
     */
    Notification getNotification(String name);
}
