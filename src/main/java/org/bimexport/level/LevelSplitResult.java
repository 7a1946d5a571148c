package org.bimexport.level;

import org.bimexport.model.ElementId;

import java.util.ArrayList;
import java.util.List;

/**
 * 按楼层拆分的结果：{@code levels} 与 {@code ranges} 等长，按下标一一对应，按起点升序且互不重叠。
 */
public record LevelSplitResult(List<ElementId> levels, List<VerticalSpan> ranges) {

    public static final LevelSplitResult EMPTY = new LevelSplitResult(List.of(), List.of());

    public LevelSplitResult {
        levels = List.copyOf(levels);
        ranges = List.copyOf(ranges);
        if (levels.size() != ranges.size()) {
            throw new IllegalArgumentException("楼层数与区间数不一致：" + levels.size() + " != " + ranges.size());
        }
    }

    public boolean isEmpty() {
        return levels.isEmpty();
    }

    public int size() {
        return levels.size();
    }

    public List<LevelFragment> fragments() {
        List<LevelFragment> result = new ArrayList<>(levels.size());
        for (int i = 0; i < levels.size(); i++) {
            result.add(new LevelFragment(levels.get(i), ranges.get(i)));
        }
        return result;
    }
}
