package org.bimexport.model;

/**
 * 构件的轴对齐包围盒（模型坐标）。
 * <p>
 * 按楼层拆分只用到 Z 方向；X/Y 缺省为 0，仅用于诊断输出。
 */
public record BoundingBox(
        double minX,
        double minY,
        double minZ,
        double maxX,
        double maxY,
        double maxZ
) {
}
