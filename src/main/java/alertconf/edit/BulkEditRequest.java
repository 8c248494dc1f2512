package alertconf.edit;

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;

/**
 * 按顺序整体生效的一批编辑, 任一失败则全部不生效
 */
public class BulkEditRequest implements Iterable<EditRequest> {
    private final ImmutableList<EditRequest> edits;

    public BulkEditRequest(List<EditRequest> edits) {
        this.edits = ImmutableList.copyOf(edits);
    }

    public static BulkEditRequest of(EditRequest... edits) {
        return new BulkEditRequest(ImmutableList.copyOf(edits));
    }

    public List<EditRequest> getEdits() {
        return edits;
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    @Override
    public Iterator<EditRequest> iterator() {
        return edits.iterator();
    }
}
