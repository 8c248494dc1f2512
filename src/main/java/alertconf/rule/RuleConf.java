package alertconf.rule;

import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 一次解析得到的完整规则快照. 所有内容都可由 rawText 重新解析得到, 快照本身只读
 */
@Getter
public class RuleConf implements NotificationRegistry {
    private final String rawText;
    private final String hash;
    private final ImmutableMap<String, String> vars;
    private final Squelches squelch;
    private final ImmutableMap<String, Template> templates;
    private final ImmutableMap<String, Macro> macros;
    private final ImmutableMap<String, Lookup> lookups;
    private final ImmutableMap<String, Notification> notifications;
    private final ImmutableMap<String, Alert> alerts;

    @Builder
    private RuleConf(String rawText,
                     Map<String, String> vars,
                     Squelches squelch,
                     Map<String, Template> templates,
                     Map<String, Macro> macros,
                     Map<String, Lookup> lookups,
                     Map<String, Notification> notifications,
                     Map<String, Alert> alerts) {
        this.rawText = rawText == null ? "" : rawText;
        this.hash = genHash(this.rawText);
        this.vars = vars == null ? ImmutableMap.of() : ImmutableMap.copyOf(vars);
        this.squelch = squelch == null ? new Squelches() : squelch;
        this.templates = templates == null ? ImmutableMap.of() : ImmutableMap.copyOf(templates);
        this.macros = macros == null ? ImmutableMap.of() : ImmutableMap.copyOf(macros);
        this.lookups = lookups == null ? ImmutableMap.of() : ImmutableMap.copyOf(lookups);
        this.notifications = notifications == null ? ImmutableMap.of() : ImmutableMap.copyOf(notifications);
        this.alerts = alerts == null ? ImmutableMap.of() : ImmutableMap.copyOf(alerts);
    }

    public static RuleConf empty() {
        return RuleConf.builder().rawText("").build();
    }

    /**
     * 规则文本的内容摘要, 用于检测并发编辑, 不用于完整性校验
     */
    public static String genHash(String text) {
        return DigestUtils.md5Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public Alert getAlert(String name) {
        return alerts.get(name);
    }

    @Override
    public Notification getNotification(String name) {
        return notifications.get(name);
    }

    public Lookup getLookup(String name) {
        return lookups.get(name);
    }

    public Template getTemplate(String name) {
        return templates.get(name);
    }

    public Macro getMacro(String name) {
        return macros.get(name);
    }

    /**
     * 告警自身的抑制规则或全局抑制规则任一匹配即抑制
     */
    public boolean squelched(Alert alert, TagSet tags) {
        return alert.getSquelch().squelched(tags) || squelch.squelched(tags);
    }

    public Predicate<TagSet> alertSquelched(Alert alert) {
        return tags -> squelched(alert, tags);
    }

    public String expand(String text, Map<String, String> localVars, boolean ignoreBadExpand) {
        return Vars.expand(text, localVars, vars, ignoreBadExpand);
    }
}
