package org.bimexport.model;

import java.util.List;

/**
 * 构件类别（封闭集合），并携带“查找底部楼层”时按优先级检查的参数列表。
 * <p>
 * 列表顺序即优先级：排在前面的参数先检查，第一个存在且为有效楼层 id 的参数即为结果。
 */
public enum ElementKind {
    WALL(List.of(LevelParameter.WALL_BASE_CONSTRAINT)),
    /**
     * 族实例；嵌套族先取最外层的父实例再检查参数。
     * <p>
     * 非内建族有两个楼层参数，SCHEDULE_ONLY 优先于 REFERENCE。
     */
    FAMILY_INSTANCE(List.of(
            LevelParameter.FAMILY_BASE_LEVEL_PARAM,
            LevelParameter.INSTANCE_SCHEDULE_ONLY_LEVEL_PARAM,
            LevelParameter.INSTANCE_REFERENCE_LEVEL_PARAM
    )),
    TRUSS(List.of(LevelParameter.TRUSS_ELEMENT_REFERENCE_LEVEL_PARAM)),
    STAIRS(List.of(LevelParameter.STAIRS_BASE_LEVEL_PARAM)),
    LEGACY_STAIRS(List.of(LevelParameter.STAIRS_BASE_LEVEL_PARAM)),
    EXTRUSION_ROOF(List.of(LevelParameter.ROOF_CONSTRAINT_LEVEL_PARAM)),
    /**
     * 管道/风管/桥架等线性机电构件：没有楼层参数，直接使用构件的参照楼层。
     */
    MEP_CURVE(List.of()),
    OTHER(List.of());

    private final List<LevelParameter> baseLevelParameters;

    ElementKind(List<LevelParameter> baseLevelParameters) {
        this.baseLevelParameters = baseLevelParameters;
    }

    public List<LevelParameter> baseLevelParameters() {
        return baseLevelParameters;
    }

    public boolean isFamilyInstance() {
        return this == FAMILY_INSTANCE;
    }
}
