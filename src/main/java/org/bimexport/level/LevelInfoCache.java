package org.bimexport.level;

import org.bimexport.model.BuildingModel;
import org.bimexport.model.ElementId;
import org.bimexport.model.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 楼层信息缓存（一次导出过程内共享）。
 * <p>
 * 设计要点：
 * <ul>
 *   <li>条目在楼层第一次参与拆分时按需创建，导出过程中不会删除。</li>
 *   <li>层高登记是幂等的：同一楼层第一次登记的非负层高为准，之后不同的值一律忽略（先写者胜）。</li>
 *   <li>登记通过 {@link ConcurrentHashMap#compute} 完成，多个线程并发处理构件时也能保证先写者胜。</li>
 *   <li>缓存随 {@link ExportPass} 创建和丢弃；新的导出过程总是从空缓存开始。</li>
 * </ul>
 */
public class LevelInfoCache {

    private static final Logger log = LoggerFactory.getLogger(LevelInfoCache.class);

    private final BuildingModel model;
    private final ConcurrentHashMap<ElementId, LevelInfo> levelInfos = new ConcurrentHashMap<>();
    private volatile List<ElementId> buildingStoriesByElevation;

    public LevelInfoCache(BuildingModel model) {
        this.model = model;
    }

    /**
     * 登记楼层的层高与上一层。
     * <p>
     * 条目不存在时先按模型楼层创建；已经登记过层高时保留原值。负的层高不构成有效登记，直接忽略。
     *
     * @return 登记后的条目（模型中不存在该楼层时为 null）
     */
    public LevelInfo register(ElementId levelId, ElementId nextLevelId, double height) {
        if (levelId == null || !levelId.isValid()) {
            return null;
        }
        if (!(height >= 0.0)) {
            log.debug("楼层 {} 的层高 {} 无效，忽略登记", levelId, height);
            return getOrCreateLevelInfo(levelId);
        }
        return levelInfos.compute(levelId, (id, existing) -> {
            LevelInfo current = (existing != null) ? existing : createLevelInfo(id);
            if (current == null) {
                return null;
            }
            if (current.isHeightKnown()) {
                if (current.heightToNextLevel() != height) {
                    log.debug("楼层 {} 已登记层高 {}，忽略新值 {}", id, current.heightToNextLevel(), height);
                }
                return current;
            }
            return current.withHeight(nextLevelId, height);
        });
    }

    /**
     * 已登记的层高；尚未计算时返回空（不会猜测一个值）。
     */
    public OptionalDouble findHeight(ElementId levelId) {
        LevelInfo info = getLevelInfo(levelId);
        if (info == null || !info.isHeightKnown()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(info.heightToNextLevel());
    }

    /**
     * 已登记的上一层；没有时返回 {@link ElementId#INVALID}。
     */
    public ElementId findNextLevel(ElementId levelId) {
        LevelInfo info = getLevelInfo(levelId);
        return info == null ? ElementId.INVALID : info.nextLevelId();
    }

    public LevelInfo getLevelInfo(ElementId levelId) {
        if (levelId == null || !levelId.isValid()) {
            return null;
        }
        return levelInfos.get(levelId);
    }

    /**
     * 取楼层信息，不存在时按模型楼层创建（层高未知）。
     *
     * @return 模型中不存在该楼层时为 null
     */
    public LevelInfo getOrCreateLevelInfo(ElementId levelId) {
        if (levelId == null || !levelId.isValid()) {
            return null;
        }
        LevelInfo info = levelInfos.get(levelId);
        if (info != null) {
            return info;
        }
        return levelInfos.computeIfAbsent(levelId, this::createLevelInfo);
    }

    /**
     * 按标高排序的建筑楼层 id；每个导出过程只从模型计算一次。
     */
    public List<ElementId> getBuildingStoriesByElevation() {
        List<ElementId> stories = buildingStoriesByElevation;
        if (stories == null) {
            synchronized (this) {
                stories = buildingStoriesByElevation;
                if (stories == null) {
                    stories = List.copyOf(LevelCatalog.buildingStoriesByElevation(model));
                    buildingStoriesByElevation = stories;
                }
            }
        }
        return stories;
    }

    /**
     * 当前缓存内容（按标高排序的副本），用于诊断输出。
     */
    public List<LevelInfo> snapshot() {
        List<LevelInfo> result = new ArrayList<>(levelInfos.values());
        result.sort((a, b) -> {
            int byElevation = Double.compare(a.elevation(), b.elevation());
            return byElevation != 0 ? byElevation : a.levelId().compareTo(b.levelId());
        });
        return Collections.unmodifiableList(result);
    }

    public int size() {
        return levelInfos.size();
    }

    private LevelInfo createLevelInfo(ElementId levelId) {
        Level level = model.findLevel(levelId);
        if (level == null) {
            return null;
        }
        double defaultHeight = level.distanceToNextLevel() == null ? 0.0 : level.distanceToNextLevel();
        return LevelInfo.unresolved(levelId, level.elevation(), defaultHeight);
    }
}
