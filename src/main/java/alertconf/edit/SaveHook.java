package alertconf.edit;

/**
 * 规则保存成功后同步调用的外部钩子(例如提交到版本库)
 */
@FunctionalInterface
public interface SaveHook {
    /**
     * @param files   规则文件位置
     * @param user    编辑人
     * @param message 提交说明
     * @param args    额外参数
     * @throws HookExecutionException 钩子执行失败
     */
    void onSave(String files, String user, String message, String... args);
}
