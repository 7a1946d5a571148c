package org.bimexport.export.dto;

/**
 * 楼层目录中的一项。
 *
 * @param id                  楼层 id
 * @param name                楼层名称
 * @param elevation           标高
 * @param buildingStory       是否为建筑楼层（参数缺省时为 true）
 * @param upToLevelId         “延伸至楼层”（未设置为 null）
 * @param distanceToNextLevel 宿主提供的默认层高（未提供为 null）
 * @param planViewId          代表平面视图（没有为 null）
 */
public record LevelEntry(
        long id,
        String name,
        double elevation,
        boolean buildingStory,
        Long upToLevelId,
        Double distanceToNextLevel,
        Long planViewId
) {
}
