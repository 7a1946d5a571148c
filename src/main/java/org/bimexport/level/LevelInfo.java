package org.bimexport.level;

import org.bimexport.model.ElementId;

/**
 * 楼层的派生信息（按楼层 id 缓存在 {@link LevelInfoCache} 中）。
 * <p>
 * 不可变：登记层高时由缓存整体替换条目。
 *
 * @param levelId           楼层 id
 * @param elevation         标高（创建时从楼层复制）
 * @param heightToNextLevel 到上一层的高度；尚未计算时为 {@link #UNKNOWN_HEIGHT}
 * @param nextLevelId       上一层 id；没有时为 {@link ElementId#INVALID}
 * @param defaultHeight     宿主提供的默认层高（没有则为 0），“延伸至楼层”不可用时回退使用
 */
public record LevelInfo(
        ElementId levelId,
        double elevation,
        double heightToNextLevel,
        ElementId nextLevelId,
        double defaultHeight
) {

    public static final double UNKNOWN_HEIGHT = -1.0;

    public static LevelInfo unresolved(ElementId levelId, double elevation, double defaultHeight) {
        return new LevelInfo(levelId, elevation, UNKNOWN_HEIGHT, ElementId.INVALID, Math.max(0.0, defaultHeight));
    }

    public boolean isHeightKnown() {
        return heightToNextLevel >= 0.0;
    }

    LevelInfo withHeight(ElementId nextLevel, double height) {
        return new LevelInfo(levelId, elevation, height, nextLevel == null ? ElementId.INVALID : nextLevel, defaultHeight);
    }
}
