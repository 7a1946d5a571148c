package org.bimexport.model;

/**
 * 宿主模型中的楼层标高（只读）。
 *
 * @param id                  楼层 id
 * @param name                楼层名称
 * @param elevation           标高（模型长度单位）
 * @param buildingStory       是否为建筑楼层（null 表示宿主未设置该参数，按“是”处理）
 * @param upToLevelId         “延伸至楼层”参数；未设置时为 {@link ElementId#INVALID}
 * @param distanceToNextLevel 宿主提供的默认层高（可能为 null）
 */
public record Level(
        ElementId id,
        String name,
        double elevation,
        Boolean buildingStory,
        ElementId upToLevelId,
        Double distanceToNextLevel
) {
    public Level {
        if (id == null) {
            throw new IllegalArgumentException("楼层 id 不能为空");
        }
        if (upToLevelId == null) {
            upToLevelId = ElementId.INVALID;
        }
    }
}
