package org.bimexport.level;

import org.bimexport.model.BuildingModel;
import org.bimexport.model.ElementId;
import org.bimexport.model.Level;
import org.bimexport.model.PlanView;
import org.bimexport.model.ViewType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 楼层目录：按标高排序的楼层视图，以及楼层相关的查询。
 * <p>
 * 排序规则：标高升序；标高完全相等时按 {@link ElementId} 数值升序（浮点标高可能恰好相等，需要一个确定的全序）。
 */
public final class LevelCatalog {

    /**
     * 楼层排序比较器（标高升序，标高相同按 id 升序）。
     */
    public static final Comparator<Level> ELEVATION_ORDER = (x, y) -> {
        if (x.id().equals(y.id())) {
            return 0;
        }
        if (x.elevation() == y.elevation()) {
            return x.id().compareTo(y.id());
        }
        return (x.elevation() > y.elevation()) ? 1 : -1;
    };

    private LevelCatalog() {
    }

    /**
     * 模型中的全部楼层，按 {@link #ELEVATION_ORDER} 排序。
     */
    public static List<Level> allLevels(BuildingModel model) {
        List<Level> levels = new ArrayList<>(model.levels());
        levels.sort(ELEVATION_ORDER);
        return levels;
    }

    /**
     * 是否为建筑楼层；宿主没有设置该参数时按“是”处理。
     */
    public static boolean isBuildingStory(Level level) {
        if (level == null) {
            return false;
        }
        return level.buildingStory() == null || level.buildingStory();
    }

    /**
     * 按标高排序的建筑楼层。
     */
    public static List<Level> buildingStories(BuildingModel model) {
        List<Level> result = new ArrayList<>();
        for (Level level : allLevels(model)) {
            if (isBuildingStory(level)) {
                result.add(level);
            }
        }
        return result;
    }

    public static List<ElementId> buildingStoriesByElevation(BuildingModel model) {
        List<ElementId> result = new ArrayList<>();
        for (Level level : buildingStories(model)) {
            result.add(level.id());
        }
        return result;
    }

    /**
     * 为每个楼层找一个代表视图。
     * <p>
     * 优先选择“由该楼层生成、且视图范围底部裁剪面也参照该楼层”的第一个视图；
     * 找不到时退而使用由该楼层生成的其他视图（多个时取最后一个）；仍找不到则该楼层不出现在结果中。
     *
     * @return 楼层 id -> 视图（按入参楼层顺序）
     */
    public static Map<ElementId, PlanView> findViewsForLevels(BuildingModel model, ViewType viewType, List<Level> levels) {
        if (levels == null || levels.isEmpty()) {
            return Map.of();
        }

        Set<ElementId> levelsToFind = new LinkedHashSet<>();
        for (Level level : levels) {
            levelsToFind.add(level.id());
        }
        Map<ElementId, PlanView> viewsForLevels = new HashMap<>();
        Map<ElementId, PlanView> possibleViewsForLevels = new HashMap<>();

        for (PlanView view : model.views()) {
            if (view.viewType() != viewType) {
                continue;
            }
            ElementId genLevelId = view.genLevelId();
            if (!genLevelId.isValid() || !levelsToFind.contains(genLevelId)) {
                continue;
            }
            if (!genLevelId.equals(view.bottomClipLevelId())) {
                possibleViewsForLevels.put(genLevelId, view);
                continue;
            }
            viewsForLevels.put(genLevelId, view);
            levelsToFind.remove(genLevelId);
        }

        for (ElementId levelId : levelsToFind) {
            PlanView possible = possibleViewsForLevels.get(levelId);
            if (possible != null) {
                viewsForLevels.put(levelId, possible);
            }
        }

        Map<ElementId, PlanView> ordered = new LinkedHashMap<>();
        for (Level level : levels) {
            PlanView view = viewsForLevels.get(level.id());
            if (view != null) {
                ordered.put(level.id(), view);
            }
        }
        return ordered;
    }

    public static boolean isViewGeneratedByLevel(PlanView view, Level level) {
        if (view == null || level == null || !view.genLevelId().isValid()) {
            return false;
        }
        return view.genLevelId().equals(level.id());
    }
}
