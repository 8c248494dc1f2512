package alertconf.edit;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对单个实体的编辑: 替换其定义文本, 或在 delete 为 true 时删除
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EditRequest {
    private String name;
    private String type;
    private String text;
    private boolean delete;

    public static EditRequest put(String type, String name, String text) {
        return new EditRequest(name, type, text, false);
    }

    public static EditRequest delete(String type, String name) {
        return new EditRequest(name, type, null, true);
    }
}
