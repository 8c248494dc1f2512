package alertconf.rule;

/**
 * 告警触发级别
 */
public enum Severity {
    WARNING,
    CRITICAL
}
