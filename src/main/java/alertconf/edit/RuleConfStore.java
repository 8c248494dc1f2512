package alertconf.edit;

import alertconf.rule.RuleConf;
import alertconf.rule.RuleConfException;
import alertconf.rule.RuleConfParser;
import alertconf.rule.RuleValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 规则文本存储 - 负责规则文本的读取、批量编辑、diff、保存与保存钩子
 * <p>
 * 写操作(bulkEdit / saveRawText / reload / setReload / setSaveHook)由同一把锁串行化, 保存钩子和重建函数也在锁内同步执行.
 * 读操作只读取不可变的 (text, hash) 快照, 不会被进行中的写操作阻塞.
 * 保存钩子失败时已写入的文本不回滚.
 */
public class RuleConfStore implements RuleConfWriter {
    private static final Logger logger = LoggerFactory.getLogger(RuleConfStore.class);

    private static final int DIFF_CONTEXT = 3;

    /**
     * 编辑状态
     */
    public enum State {
        CLEAN,
        EDITING
    }

    private record Snapshot(String text, String hash) {
        static Snapshot of(String text) {
            return new Snapshot(text, RuleConf.genHash(text));
        }
    }

    private final Path ruleFile;
    private final RuleConfParser parser;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile Snapshot snapshot;
    private volatile State state = State.CLEAN;
    private Reloader reload;
    private SaveHook saveHook;

    /**
     * @param ruleFile    规则文件, 为 null 时只在内存中保存
     * @param initialText 初始规则文本
     */
    public RuleConfStore(Path ruleFile, String initialText, RuleConfParser parser,
                         Reloader reload, SaveHook saveHook) {
        this.ruleFile = ruleFile;
        this.parser = parser;
        this.snapshot = Snapshot.of(initialText == null ? "" : initialText);
        this.reload = reload;
        this.saveHook = saveHook;
    }

    /**
     * 从文件加载规则文本, 文件不存在时从空文本开始
     */
    public static RuleConfStore open(Path ruleFile, RuleConfParser parser) {
        String text = "";
        try {
            if (Files.exists(ruleFile)) {
                text = Files.readString(ruleFile, StandardCharsets.UTF_8);
            } else {
                logger.warn("规则文件不存在, 使用空配置: {}", ruleFile);
            }
        } catch (IOException e) {
            throw new RuleConfException("读取规则文件失败: " + ruleFile, e);
        }
        logger.info("加载规则文件: {}", ruleFile);
        return new RuleConfStore(ruleFile, text, parser, null, null);
    }

    /**
     * 批量编辑. 所有编辑按顺序应用, 只替换被编辑实体所在的行, 整体校验通过后才写入; 任一失败时文本保持不变
     *
     * @throws RuleValidationException 任一编辑无效或结果文本无法解析
     */
    @Override
    public void bulkEdit(BulkEditRequest request) {
        writeLock.lock();
        state = State.EDITING;
        try {
            String current = snapshot.text();
            ObjectNode root = parser.readTree(current);
            String spliced = current;
            for (EditRequest edit : request) {
                String name = apply(root, edit);
                spliced = splice(spliced, name, edit);
            }
            String candidate = candidateText(root, spliced);
            parser.parse(candidate);

            persist(candidate);
            snapshot = Snapshot.of(candidate);
            logger.info("批量编辑完成: edits={}, hash={}", request.getEdits().size(), snapshot.hash());
        } finally {
            state = State.CLEAN;
            writeLock.unlock();
        }
    }

    /**
     * 优先使用按行替换的文本; 替换结果与规则树不一致时重新序列化整棵树, 此时文本中的注释和格式会丢失
     */
    private String candidateText(ObjectNode root, String spliced) {
        if (spliced != null && sameTree(root, spliced)) {
            return spliced;
        }
        logger.warn("无法按行替换实体, 规则文本将整体重新生成");
        return root.isEmpty() ? "" : parser.write(root);
    }

    private String splice(String text, String name, EditRequest edit) {
        if (text == null) {
            return null;
        }
        try {
            return EntityTextSplicer.apply(parser, text, EntityType.fromString(edit.getType()), name, edit);
        } catch (RuleValidationException e) {
            logger.debug("按行替换实体失败: {}", name, e);
            return null;
        }
    }

    private boolean sameTree(ObjectNode root, String text) {
        try {
            return root.equals(parser.readTree(text));
        } catch (RuleValidationException e) {
            logger.debug("按行替换后的文本无法解析", e);
            return false;
        }
    }

    /**
     * 把编辑应用到规则树上并校验请求本身
     *
     * @return 实体名称
     */
    private String apply(ObjectNode root, EditRequest edit) {
        EntityType type = EntityType.fromString(edit.getType());
        String name = StringUtils.trimToNull(edit.getName());
        if (name == null) {
            throw new RuleValidationException("编辑请求缺少实体名称");
        }
        JsonNode sectionNode = root.get(type.getSection());
        if (sectionNode != null && !sectionNode.isNull() && !sectionNode.isObject()) {
            throw new RuleValidationException("配置段 " + type.getSection() + " 必须是映射");
        }
        ObjectNode section = sectionNode instanceof ObjectNode
                ? (ObjectNode) sectionNode
                : root.putObject(type.getSection());

        if (edit.isDelete()) {
            if (section.remove(name) == null) {
                throw new RuleValidationException(String.format("要删除的 %s 不存在: %s",
                        type.name().toLowerCase(), name));
            }
            if (section.isEmpty()) {
                root.remove(type.getSection());
            }
            return name;
        }
        section.set(name, parser.readEntity(edit.getText()));
        return name;
    }

    @Override
    public String getRawText() {
        return snapshot.text();
    }

    @Override
    public String getHash() {
        return snapshot.hash();
    }

    public State getState() {
        return state;
    }

    public Path getRuleFile() {
        return ruleFile;
    }

    /**
     * 当前文本与候选文本的 unified diff, 相同时返回空串
     *
     * @throws RuleValidationException 候选文本为 null
     */
    @Override
    public String rawDiff(String rawConf) {
        if (rawConf == null) {
            throw new RuleValidationException("规则文本不能为空");
        }
        String current = snapshot.text();
        if (current.equals(rawConf)) {
            return "";
        }
        List<String> original = lines(current);
        List<String> revised = lines(rawConf);
        Patch<String> patch = DiffUtils.diff(original, revised);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
                "running-config", "new-config", original, patch, DIFF_CONTEXT);
        return String.join("\n", unified);
    }

    /**
     * 保存完整规则文本, 然后同步执行保存钩子. 重建配置由调用方随后调用 {@link #reload()}
     *
     * @param diff 调用方看到的 diff, 不为 null 时必须与当前计算结果一致
     * @throws RuleValidationException 文本无效或与当前文本相同
     * @throws StaleEditException      规则文本已被其他编辑修改
     * @throws HookExecutionException  钩子失败, 此时文本已保存
     */
    @Override
    public void saveRawText(String rawConf, String diff, String user, String message, String... args) {
        writeLock.lock();
        state = State.EDITING;
        try {
            if (rawConf == null) {
                throw new RuleValidationException("规则文本不能为空");
            }
            parser.parse(rawConf);
            if (rawConf.equals(snapshot.text())) {
                throw new RuleValidationException("规则未保存: 内容没有变化");
            }
            if (diff != null && !diff.equals(rawDiff(rawConf))) {
                throw new StaleEditException("规则未保存: 提交的 diff 与当前 diff 不一致, 规则可能已被其他人修改");
            }

            persist(rawConf);
            snapshot = Snapshot.of(rawConf);
            logger.info("规则已保存: user={}, hash={}, message={}", user, snapshot.hash(), message);

            if (saveHook != null) {
                String files = ruleFile == null ? "" : ruleFile.toString();
                saveHook.onSave(files, user, message, args);
            }
        } finally {
            state = State.CLEAN;
            writeLock.unlock();
        }
    }

    /**
     * 在写锁内调用已注册的重建函数, 重建期间不会有编辑或其他重建插入.
     * 失败包装为 {@link ReloadException}, 与保存失败区分
     */
    public void reload() {
        writeLock.lock();
        try {
            if (reload == null) {
                logger.warn("未注册重建函数, 跳过重建");
                return;
            }
            reload.reload();
        } catch (Exception e) {
            throw new ReloadException("规则已保存, 但重建配置失败: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void setReload(Reloader reload) {
        writeLock.lock();
        try {
            this.reload = reload;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void setSaveHook(SaveHook hook) {
        writeLock.lock();
        try {
            this.saveHook = hook;
        } finally {
            writeLock.unlock();
        }
    }

    private void persist(String text) {
        if (ruleFile == null) {
            return;
        }
        try {
            Path dir = ruleFile.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, ruleFile.getFileName().toString(), ".tmp");
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, ruleFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, ruleFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuleConfException("写入规则文件失败: " + ruleFile, e);
        }
    }

    private static List<String> lines(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\n", -1));
    }
}
