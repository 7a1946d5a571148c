package org.bimexport.export.dto;

/**
 * 导出过程结束时楼层信息缓存中的一项。
 *
 * @param levelId           楼层 id
 * @param elevation         标高
 * @param heightToNextLevel 层高（未计算为 null；0 表示向上不限）
 * @param nextLevelId       上一层（没有为 null）
 */
public record LevelInfoEntry(
        long levelId,
        double elevation,
        Double heightToNextLevel,
        Long nextLevelId
) {
}
