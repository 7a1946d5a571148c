package org.bimexport.level;

import org.bimexport.model.BuildingModel;
import org.bimexport.model.ElementId;
import org.bimexport.model.Level;
import org.bimexport.model.PlanView;
import org.bimexport.model.ViewType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次导出过程的作用域对象。
 * <p>
 * 持有本次导出共享的状态：模型、选项、楼层信息缓存、视图 -> 楼层映射，以及基于它们的解析器/拆分器。
 * 同一导出过程内的所有拆分调用共享同一个缓存；开始新的导出过程即得到一个空缓存。
 */
public final class ExportPass {

    private final BuildingModel model;
    private final ExportOptions options;
    private final LevelInfoCache levelInfoCache;
    private final Map<ElementId, ElementId> viewLevels;
    private final BaseLevelResolver baseLevelResolver;
    private final NextLevelHeightCalculator heightCalculator;
    private final LevelRangeSplitter splitter;

    private ExportPass(BuildingModel model, ExportOptions options, Map<ElementId, ElementId> viewLevels) {
        this.model = model;
        this.options = options;
        this.levelInfoCache = new LevelInfoCache(model);
        this.viewLevels = Map.copyOf(viewLevels);
        this.baseLevelResolver = new BaseLevelResolver(model, this.viewLevels);
        this.heightCalculator = new NextLevelHeightCalculator(model, levelInfoCache);
        this.splitter = new LevelRangeSplitter(options, levelInfoCache, baseLevelResolver, heightCalculator);
    }

    /**
     * 开始一次导出过程；视图 -> 楼层映射取自各建筑楼层的代表平面视图。
     */
    public static ExportPass begin(BuildingModel model, ExportOptions options) {
        return begin(model, options, planViewLevels(model));
    }

    /**
     * 开始一次导出过程，并显式指定视图 -> 楼层映射。
     */
    public static ExportPass begin(BuildingModel model, ExportOptions options, Map<ElementId, ElementId> viewLevels) {
        if (model == null) {
            throw new IllegalArgumentException("模型不能为空");
        }
        return new ExportPass(
                model,
                options == null ? ExportOptions.defaults() : options,
                viewLevels == null ? Map.of() : viewLevels
        );
    }

    /**
     * 建筑楼层的代表平面视图，转换为视图 id -> 楼层 id。
     */
    static Map<ElementId, ElementId> planViewLevels(BuildingModel model) {
        List<Level> stories = LevelCatalog.buildingStories(model);
        Map<ElementId, PlanView> viewsForLevels = LevelCatalog.findViewsForLevels(model, ViewType.FLOOR_PLAN, stories);
        Map<ElementId, ElementId> result = new LinkedHashMap<>();
        for (Map.Entry<ElementId, PlanView> entry : viewsForLevels.entrySet()) {
            result.put(entry.getValue().id(), entry.getKey());
        }
        return result;
    }

    public BuildingModel model() {
        return model;
    }

    public ExportOptions options() {
        return options;
    }

    public LevelInfoCache levelInfoCache() {
        return levelInfoCache;
    }

    public Map<ElementId, ElementId> viewLevels() {
        return viewLevels;
    }

    public BaseLevelResolver baseLevelResolver() {
        return baseLevelResolver;
    }

    public NextLevelHeightCalculator heightCalculator() {
        return heightCalculator;
    }

    public LevelRangeSplitter splitter() {
        return splitter;
    }
}
