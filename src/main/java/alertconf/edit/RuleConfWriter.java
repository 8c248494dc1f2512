package alertconf.edit;

/**
 * 规则文本的写入协议. 同一时刻只允许一个写操作
 */
public interface RuleConfWriter {
    void bulkEdit(BulkEditRequest request);

    String getRawText();

    String getHash();

    void saveRawText(String rawConf, String diff, String user, String message, String... args);

    String rawDiff(String rawConf);

    void setReload(Reloader reload);

    void setSaveHook(SaveHook hook);
}
