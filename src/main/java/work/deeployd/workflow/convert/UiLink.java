package work.deeployd.workflow.convert;

import java.util.ArrayList;
import java.util.List;

/**
 * One row of the UI link table: {@code [id, source, sourceSlot, target, targetSlot]}.
 * Node ids are Integers for numeric ids and Strings otherwise.
 */
public record UiLink(int id, Object sourceNodeId, int sourceSlot, Object targetNodeId, int targetSlot) {
    List<Object> toList() {
        var row = new ArrayList<Object>(5);
        row.add(id);
        row.add(sourceNodeId);
        row.add(sourceSlot);
        row.add(targetNodeId);
        row.add(targetSlot);
        return row;
    }
}
