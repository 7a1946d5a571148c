package org.bimexport.model;

/**
 * 构件上“值为楼层 id”的内置参数。
 */
public enum LevelParameter {
    WALL_BASE_CONSTRAINT,
    /**
     * 内建族（in-place）的底部楼层。
     */
    FAMILY_BASE_LEVEL_PARAM,
    INSTANCE_SCHEDULE_ONLY_LEVEL_PARAM,
    INSTANCE_REFERENCE_LEVEL_PARAM,
    TRUSS_ELEMENT_REFERENCE_LEVEL_PARAM,
    STAIRS_BASE_LEVEL_PARAM,
    ROOF_CONSTRAINT_LEVEL_PARAM
}
