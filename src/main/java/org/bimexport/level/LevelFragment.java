package org.bimexport.level;

import org.bimexport.model.ElementId;

/**
 * 拆分结果中的一个片段：所属楼层 + 竖向区间。
 */
public record LevelFragment(ElementId levelId, VerticalSpan span) {
}
