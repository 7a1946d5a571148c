package org.bimexport.level;

import org.bimexport.model.BoundingBox;
import org.bimexport.model.ElementId;
import org.bimexport.model.ExportInfoPair;
import org.bimexport.model.IfcEntityType;
import org.bimexport.model.ModelElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * 按楼层拆分构件的竖向范围。
 * <p>
 * 柱、墙、风管等构件可能跨越多个楼层；导出时需要把它们的竖向范围切成若干段，每段归属一个建筑楼层。
 * 这里只计算一维区间，真正的几何切分由调用方根据结果完成。
 * <p>
 * 算法：从构件的底部楼层开始，按标高顺序单次遍历建筑楼层：
 * <ul>
 *   <li>构件在本层标高（加容差）之下就已结束：跳过本层。</li>
 *   <li>构件在本层顶部（减容差）之上才开始：跳过本层。层高为 0 的楼层视为向上无限延伸，不做此判断。</li>
 *   <li>本层设置了“延伸至楼层”时，直接跳到该楼层，中间的楼层不再参与。</li>
 *   <li>构件剩余部分完全落在本层内（容差内）：输出最后一段并结束。</li>
 *   <li>否则输出本层这一段；每段的起点不低于上一段终点；
 *       若某段终点没有超过上一段终点（考虑容差），丢弃该段。</li>
 * </ul>
 * 底部楼层以下的部分并入第一段；只有最低建筑楼层以下（超出容差）的部分没有楼层可归属，会被裁掉。
 * 所有边界比较都使用 {@link ExportOptions#levelExtension()} 作为容差。
 */
public class LevelRangeSplitter {

    private static final Logger log = LoggerFactory.getLogger(LevelRangeSplitter.class);

    /**
     * 判断层高是否为 0 的数值精度。
     */
    static final double ZERO_TOLERANCE = 1.0e-9;

    private final ExportOptions options;
    private final LevelInfoCache levelInfoCache;
    private final BaseLevelResolver baseLevelResolver;
    private final NextLevelHeightCalculator heightCalculator;

    public LevelRangeSplitter(
            ExportOptions options,
            LevelInfoCache levelInfoCache,
            BaseLevelResolver baseLevelResolver,
            NextLevelHeightCalculator heightCalculator
    ) {
        this.options = options;
        this.levelInfoCache = levelInfoCache;
        this.baseLevelResolver = baseLevelResolver;
        this.heightCalculator = heightCalculator;
    }

    /**
     * 是否需要按楼层拆分：实例为柱/墙，或类型为风管段类型。
     */
    public static boolean splitsByLevel(ExportInfoPair exportType) {
        if (exportType == null) {
            return false;
        }
        IfcEntityType instance = exportType.exportInstance();
        return instance == IfcEntityType.IfcColumn
                || instance == IfcEntityType.IfcWall
                || exportType.exportType() == IfcEntityType.IfcDuctSegmentType;
    }

    /**
     * 使用构件自身的导出分类和包围盒拆分。
     */
    public LevelSplitResult split(ModelElement element) {
        return split(element, element.exportInfo());
    }

    /**
     * 使用指定导出分类和构件包围盒的 Z 范围拆分；没有包围盒时返回空结果。
     */
    public LevelSplitResult split(ModelElement element, ExportInfoPair exportType) {
        if (!options.splitWallsAndColumns() || !splitsByLevel(exportType)) {
            return LevelSplitResult.EMPTY;
        }
        BoundingBox boundingBox = element.boundingBox();
        if (boundingBox == null || !(boundingBox.minZ() < boundingBox.maxZ())) {
            return LevelSplitResult.EMPTY;
        }
        return segment(element, exportType, new VerticalSpan(boundingBox.minZ(), boundingBox.maxZ()));
    }

    /**
     * 把竖向范围 {@code zSpan} 拆分到各建筑楼层。
     *
     * @param element    构件（用于确定底部楼层）
     * @param exportType 导出分类
     * @param zSpan      构件的竖向范围
     * @return 楼层与区间一一对应、按起点升序且互不重叠的结果；不需要拆分时为空
     */
    public LevelSplitResult segment(ModelElement element, ExportInfoPair exportType, VerticalSpan zSpan) {
        if (!options.splitWallsAndColumns() || !splitsByLevel(exportType)) {
            return LevelSplitResult.EMPTY;
        }
        if (zSpan == null || !(zSpan.start() < zSpan.end())) {
            return LevelSplitResult.EMPTY;
        }

        double extension = options.levelExtension();

        // 底部楼层之下的楼层不参与；底部楼层未知时从第一个建筑楼层开始
        ElementId firstLevelId = baseLevelResolver.resolveBaseLevel(element);
        SplitState state = new SplitState(!firstLevelId.isValid());

        List<ElementId> stories = levelInfoCache.getBuildingStoriesByElevation();
        ElementId lowestStoryId = stories.isEmpty() ? ElementId.INVALID : stories.get(0);

        for (ElementId levelId : stories) {
            if (!state.foundFirstLevel) {
                if (!levelId.equals(firstLevelId)) {
                    continue;
                }
                state.foundFirstLevel = true;
            }

            if (state.skipToNextLevel.isValid() && !levelId.equals(state.skipToNextLevel)) {
                continue;
            }

            LevelInfo levelInfo = levelInfoCache.getOrCreateLevelInfo(levelId);
            if (levelInfo == null) {
                continue;
            }
            double elevation = levelInfo.elevation();

            // endBelowLevel
            if (zSpan.end() < elevation + extension) {
                continue;
            }

            double levelHeight = heightOf(levelId, levelInfo);
            state.skipToNextLevel = levelInfoCache.findNextLevel(levelId);
            boolean bounded = !isAlmostZero(levelHeight);

            // startAboveLevel
            if (bounded && zSpan.start() > elevation + levelHeight - extension) {
                continue;
            }

            boolean startBelowLevel = state.hasFragments() && zSpan.start() < elevation - extension;
            boolean endAboveLevel = bounded && zSpan.end() > elevation + levelHeight + extension;
            double lowerBound = lowerBound(zSpan, levelId.equals(lowestStoryId), elevation, extension);
            if (!startBelowLevel && !endAboveLevel) {
                state.append(levelId, new VerticalSpan(lowerBound, zSpan.end()), extension);
                break;
            }

            VerticalSpan currentSpan = new VerticalSpan(
                    startBelowLevel ? elevation : lowerBound,
                    endAboveLevel ? elevation + levelHeight : zSpan.end()
            );
            state.append(levelId, currentSpan, extension);
        }

        LevelSplitResult result = state.toResult();
        if (log.isDebugEnabled()) {
            log.debug("构件 {} 竖向范围 [{}, {}]，底部楼层 {}，拆分为 {} 段",
                    element.id(), zSpan.start(), zSpan.end(), firstLevelId, result.size());
        }
        return result;
    }

    /**
     * 首段的起点：保留构件起点；只有在最低建筑楼层且低于其标高（超出容差）时才抬到该标高。
     */
    private static double lowerBound(VerticalSpan zSpan, boolean lowestStory, double elevation, double extension) {
        if (lowestStory && zSpan.start() < elevation - extension) {
            return elevation;
        }
        return zSpan.start();
    }

    private double heightOf(ElementId levelId, LevelInfo levelInfo) {
        OptionalDouble cached = levelInfoCache.findHeight(levelId);
        if (cached.isPresent()) {
            return cached.getAsDouble();
        }
        return heightCalculator.calculateDistanceToNextLevel(levelId, levelInfo);
    }

    static boolean isAlmostZero(double value) {
        return Math.abs(value) < ZERO_TOLERANCE;
    }

    /**
     * 单次遍历中跨楼层携带的状态。
     */
    private static final class SplitState {

        private boolean foundFirstLevel;
        private ElementId skipToNextLevel = ElementId.INVALID;
        private final List<ElementId> levels = new ArrayList<>();
        private final List<VerticalSpan> ranges = new ArrayList<>();

        private SplitState(boolean foundFirstLevel) {
            this.foundFirstLevel = foundFirstLevel;
        }

        private boolean hasFragments() {
            return !ranges.isEmpty();
        }

        /**
         * 追加一段，保证各段互不重叠：起点抬到上一段终点；终点没有超过上一段终点（容差内）则丢弃。
         */
        private void append(ElementId levelId, VerticalSpan candidate, double extension) {
            VerticalSpan span = candidate;
            if (!ranges.isEmpty()) {
                VerticalSpan lastSpan = ranges.get(ranges.size() - 1);
                if (lastSpan.end() >= span.end() - extension) {
                    log.debug("楼层 {} 的区间 [{}, {}] 未超出上一段终点 {}，已丢弃",
                            levelId, span.start(), span.end(), lastSpan.end());
                    return;
                }
                span = new VerticalSpan(Math.max(span.start(), lastSpan.end()), span.end());
            }
            if (span.isEmpty()) {
                return;
            }
            levels.add(levelId);
            ranges.add(span);
        }

        private LevelSplitResult toResult() {
            return levels.isEmpty() ? LevelSplitResult.EMPTY : new LevelSplitResult(levels, ranges);
        }
    }
}
