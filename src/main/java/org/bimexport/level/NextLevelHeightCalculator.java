package org.bimexport.level;

import org.bimexport.model.BuildingModel;
import org.bimexport.model.ElementId;
import org.bimexport.model.Level;

/**
 * 计算楼层到上一层的高度，并登记到 {@link LevelInfoCache}。
 * <p>
 * 楼层设置了“延伸至楼层”且目标是标高更高的建筑楼层时，层高为两者标高差，上一层即目标楼层；
 * 否则回退到宿主提供的默认层高（没有则为 0），上一层为空。
 */
public class NextLevelHeightCalculator {

    private final BuildingModel model;
    private final LevelInfoCache levelInfoCache;

    public NextLevelHeightCalculator(BuildingModel model, LevelInfoCache levelInfoCache) {
        this.model = model;
        this.levelInfoCache = levelInfoCache;
    }

    /**
     * @return 缓存中最终生效的层高（若其他调用已先登记，以先登记的值为准）
     */
    public double calculateDistanceToNextLevel(ElementId levelId, LevelInfo levelInfo) {
        double height = 0.0;
        ElementId nextLevelId = ElementId.INVALID;

        Level level = model.findLevel(levelId);
        if (level != null && level.upToLevelId().isValid()) {
            Level possibleNextLevel = model.findLevel(level.upToLevelId());
            if (possibleNextLevel != null && LevelCatalog.isBuildingStory(possibleNextLevel)) {
                double netElevation = possibleNextLevel.elevation() - level.elevation();
                if (netElevation > 0.0) {
                    height = netElevation;
                    nextLevelId = possibleNextLevel.id();
                }
            }
        }

        if (height <= 0.0 && levelInfo != null) {
            height = levelInfo.defaultHeight();
        }

        LevelInfo registered = levelInfoCache.register(levelId, nextLevelId, height);
        return (registered != null && registered.isHeightKnown()) ? registered.heightToNextLevel() : height;
    }
}
