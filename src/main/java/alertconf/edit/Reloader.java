package alertconf.edit;

/**
 * 根据当前规则文本重建告警、通知、查找表
 */
@FunctionalInterface
public interface Reloader {
    void reload() throws Exception;
}
