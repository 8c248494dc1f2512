package alertconf.rule;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 通知模板, 只保存原始文本, 渲染不在本模块
 */
@Getter
@Builder
@ToString(of = "name")
public class Template {
    private final String name;
    private final String text;
    private final String subject;
    private final String body;
    private final Locator locator;
}
