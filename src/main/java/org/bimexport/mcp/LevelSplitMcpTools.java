package org.bimexport.mcp;

import org.bimexport.export.LevelSplitProperties;
import org.bimexport.export.ModelFileResolver;
import org.bimexport.export.dto.BaseLevelResult;
import org.bimexport.export.dto.ElementSplitResult;
import org.bimexport.export.dto.ElementSplitToolResult;
import org.bimexport.export.dto.FragmentEntry;
import org.bimexport.export.dto.LevelCatalogResult;
import org.bimexport.export.dto.LevelEntry;
import org.bimexport.export.dto.LevelInfoEntry;
import org.bimexport.export.dto.ModelSplitResult;
import org.bimexport.level.BaseLevelResolver;
import org.bimexport.level.ElementCompositionType;
import org.bimexport.level.ExportOptions;
import org.bimexport.level.ExportPass;
import org.bimexport.level.LevelCatalog;
import org.bimexport.level.LevelFragment;
import org.bimexport.level.LevelInfo;
import org.bimexport.level.LevelRangeSplitter;
import org.bimexport.level.LevelSplitResult;
import org.bimexport.model.BoundingBox;
import org.bimexport.model.BuildingModel;
import org.bimexport.model.ElementId;
import org.bimexport.model.ExportInfoPair;
import org.bimexport.model.IfcEntityType;
import org.bimexport.model.Level;
import org.bimexport.model.ModelElement;
import org.bimexport.model.PlanView;
import org.bimexport.model.ViewType;
import org.bimexport.model.json.BuildingModelReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 按楼层拆分的 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>楼层目录（{@code bim_list_levels}）。</li>
 *   <li>构件底部楼层解析（{@code bim_resolve_base_level}）。</li>
 *   <li>单个构件按楼层拆分（{@code bim_split_element}）。</li>
 *   <li>整个模型按楼层拆分（{@code bim_split_model}），并返回导出过程结束时的楼层信息缓存。</li>
 * </ul>
 * <p>
 * 每次工具调用读取一次模型文件并开始一次新的导出过程（{@link ExportPass}），调用之间不共享缓存。
 */
@Component
public class LevelSplitMcpTools {

    private static final Logger log = LoggerFactory.getLogger(LevelSplitMcpTools.class);

    private final LevelSplitProperties properties;
    private final ModelFileResolver modelFileResolver;

    public LevelSplitMcpTools(LevelSplitProperties properties, ModelFileResolver modelFileResolver) {
        // properties：根目录白名单、文件大小上限、拆分选项
        this.properties = properties;
        // modelFileResolver：把用户输入的路径解析成白名单内的模型文件
        this.modelFileResolver = modelFileResolver;
    }

    @Tool(
            name = "bim_list_levels",
            description = "列出模型中的全部楼层（按标高升序，标高相同按 id 升序），并标注是否为建筑楼层及其代表平面视图。"
    )
    /**
     * 返回楼层目录。
     */
    public LevelCatalogResult listLevels(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "模型 JSON 文件路径（相对 rootId 或绝对路径）") String path
    ) {
        ModelFileResolver.ResolvedPath resolved = modelFileResolver.resolve(rootId, path);
        BuildingModel model = loadModel(resolved);

        List<Level> levels = LevelCatalog.allLevels(model);
        List<Level> stories = LevelCatalog.buildingStories(model);
        Map<ElementId, PlanView> planViews = LevelCatalog.findViewsForLevels(model, ViewType.FLOOR_PLAN, levels);

        List<LevelEntry> entries = new ArrayList<>(levels.size());
        for (Level level : levels) {
            PlanView view = planViews.get(level.id());
            entries.add(new LevelEntry(
                    level.id().value(),
                    level.name(),
                    level.elevation(),
                    LevelCatalog.isBuildingStory(level),
                    idOrNull(level.upToLevelId()),
                    level.distanceToNextLevel(),
                    view == null ? null : view.id().value()
            ));
        }
        return new LevelCatalogResult(resolved.rootId(), resolved.displayPath(), entries, stories.size());
    }

    @Tool(
            name = "bim_resolve_base_level",
            description = "解析构件的底部楼层（视图专有构件取所属视图楼层；否则按构件类别的楼层参数优先级查找；最后回退到构件楼层）。"
    )
    /**
     * 返回构件的底部楼层及其来源。
     */
    public BaseLevelResult resolveBaseLevel(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "模型 JSON 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(description = "构件 id") Long elementId
    ) {
        ModelFileResolver.ResolvedPath resolved = modelFileResolver.resolve(rootId, path);
        BuildingModel model = loadModel(resolved);
        ModelElement element = requireElement(model, elementId);

        ExportPass pass = ExportPass.begin(model, properties.toExportOptions());
        BaseLevelResolver.Resolution resolution = pass.baseLevelResolver().resolve(element);
        Level baseLevel = model.findLevel(resolution.levelId());

        return new BaseLevelResult(
                resolved.rootId(),
                resolved.displayPath(),
                element.id().value(),
                element.kind().name(),
                idOrNull(resolution.levelId()),
                baseLevel == null ? null : baseLevel.name(),
                resolution.source().name(),
                resolution.parameter() == null ? null : resolution.parameter().name(),
                resolution.checkedElementId().value(),
                LevelCatalog.isBuildingStory(baseLevel)
        );
    }

    @Tool(
            name = "bim_split_element",
            description = "把单个构件的竖向范围按建筑楼层拆分成互不重叠的片段（仅柱/墙实例与风管段类型参与拆分）。"
    )
    /**
     * 单个构件按楼层拆分。
     * <p>
     * exportInstance/exportType 可覆盖构件自身的导出分类，用于预览“如果按柱导出会怎样拆分”。
     */
    public ElementSplitToolResult splitElement(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "模型 JSON 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(description = "构件 id") Long elementId,
            @ToolParam(required = false, description = "覆盖实例实体类型，例如 IfcColumn/IfcWall（为空使用构件自身的）") String exportInstance,
            @ToolParam(required = false, description = "覆盖类型实体类型，例如 IfcDuctSegmentType（为空使用构件自身的）") String exportType
    ) {
        ModelFileResolver.ResolvedPath resolved = modelFileResolver.resolve(rootId, path);
        BuildingModel model = loadModel(resolved);
        ModelElement element = requireElement(model, elementId);

        ExportInfoPair exportInfo = new ExportInfoPair(
                parseEntityType(exportInstance, element.exportInfo().exportInstance()),
                parseEntityType(exportType, element.exportInfo().exportType())
        );

        ExportOptions options = properties.toExportOptions();
        ExportPass pass = ExportPass.begin(model, options);
        LevelSplitResult result = pass.splitter().split(element, exportInfo);
        return new ElementSplitToolResult(
                resolved.rootId(),
                resolved.displayPath(),
                options.splitWallsAndColumns(),
                options.levelExtension(),
                toElementResult(model, element, exportInfo, result)
        );
    }

    @Tool(
            name = "bim_split_model",
            description = "在同一次导出过程内把模型中所有构件按楼层拆分，返回拆分出片段的构件及楼层信息缓存。"
    )
    /**
     * 整个模型按楼层拆分。
     * <p>
     * 所有构件共享同一个楼层信息缓存，因此同一楼层的层高对所有构件一致。
     */
    public ModelSplitResult splitModel(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "模型 JSON 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "最多处理的构件数（默认 app.export.split-model-default-max-elements，上限 app.export.split-model-max-elements）") Integer maxElements
    ) {
        ModelFileResolver.ResolvedPath resolved = modelFileResolver.resolve(rootId, path);
        BuildingModel model = loadModel(resolved);

        int limit = resolveLimit(maxElements, properties.getSplitModelDefaultMaxElements(), properties.getSplitModelMaxElements());
        ExportOptions options = properties.toExportOptions();
        ExportPass pass = ExportPass.begin(model, options);
        LevelRangeSplitter splitter = pass.splitter();

        List<ModelElement> elements = model.elements();
        List<ElementSplitResult> split = new ArrayList<>();
        int processed = 0;
        for (ModelElement element : elements) {
            if (processed >= limit) {
                break;
            }
            processed++;
            LevelSplitResult result = splitter.split(element);
            if (!result.isEmpty()) {
                split.add(toElementResult(model, element, element.exportInfo(), result));
            }
        }
        boolean truncated = processed < elements.size();
        log.info("模型 {} 按楼层拆分完成：处理 {}/{} 个构件，{} 个构件被拆分",
                resolved.displayPath(), processed, elements.size(), split.size());

        List<LevelInfoEntry> levelInfos = new ArrayList<>();
        for (LevelInfo info : pass.levelInfoCache().snapshot()) {
            levelInfos.add(new LevelInfoEntry(
                    info.levelId().value(),
                    info.elevation(),
                    info.isHeightKnown() ? info.heightToNextLevel() : null,
                    idOrNull(info.nextLevelId())
            ));
        }

        return new ModelSplitResult(
                resolved.rootId(),
                resolved.displayPath(),
                options.splitWallsAndColumns(),
                options.levelExtension(),
                elements.size(),
                processed,
                truncated,
                split.size(),
                split,
                levelInfos
        );
    }

    private BuildingModel loadModel(ModelFileResolver.ResolvedPath resolved) {
        return BuildingModelReader.read(resolved.absolutePath(), properties.getModelMaxBytes().toBytes());
    }

    private static ModelElement requireElement(BuildingModel model, Long elementId) {
        if (elementId == null) {
            throw new IllegalArgumentException("参数错误：elementId 不能为空");
        }
        ModelElement element = model.findElement(ElementId.of(elementId));
        if (element == null) {
            throw new IllegalArgumentException("构件不存在：" + elementId);
        }
        return element;
    }

    private static ElementSplitResult toElementResult(
            BuildingModel model,
            ModelElement element,
            ExportInfoPair exportInfo,
            LevelSplitResult result
    ) {
        List<FragmentEntry> fragments = new ArrayList<>(result.size());
        for (LevelFragment fragment : result.fragments()) {
            Level level = model.findLevel(fragment.levelId());
            fragments.add(new FragmentEntry(
                    fragment.levelId().value(),
                    level == null ? null : level.name(),
                    fragment.span().start(),
                    fragment.span().end()
            ));
        }
        BoundingBox box = element.boundingBox();
        return new ElementSplitResult(
                element.id().value(),
                element.name(),
                exportInfo.exportInstance().name(),
                exportInfo.exportType().name(),
                LevelRangeSplitter.splitsByLevel(exportInfo),
                box == null ? null : box.minZ(),
                box == null ? null : box.maxZ(),
                ElementCompositionType.resolve(element).name(),
                fragments
        );
    }

    private static IfcEntityType parseEntityType(String raw, IfcEntityType fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        for (IfcEntityType type : IfcEntityType.values()) {
            if (type.name().equalsIgnoreCase(raw.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("不支持的 IFC 实体类型：" + raw);
    }

    private static int resolveLimit(Integer requested, int defaultValue, int maxValue) {
        int value = (requested == null) ? defaultValue : requested;
        if (value < 1) {
            throw new IllegalArgumentException("参数错误：maxElements 必须大于 0（" + value + "）");
        }
        return Math.min(value, maxValue);
    }

    private static Long idOrNull(ElementId id) {
        return (id == null || !id.isValid()) ? null : id.value();
    }
}
