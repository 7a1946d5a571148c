package org.bimexport.level;

/**
 * 一次导出过程的选项（导出开始时读取一次）。
 *
 * @param splitWallsAndColumns 是否按楼层拆分墙/柱/风管
 * @param levelExtension       楼层边界容差：构件越过楼层边界不超过该距离时不拆分（模型长度单位）
 */
public record ExportOptions(boolean splitWallsAndColumns, double levelExtension) {

    /**
     * 10cm，以英尺表示。
     */
    public static final double DEFAULT_LEVEL_EXTENSION = 10.0 / (12.0 * 2.54);

    public ExportOptions {
        if (!(levelExtension >= 0.0) || Double.isInfinite(levelExtension)) {
            throw new IllegalArgumentException("楼层边界容差必须是非负有限数：" + levelExtension);
        }
    }

    public static ExportOptions defaults() {
        return new ExportOptions(true, DEFAULT_LEVEL_EXTENSION);
    }
}
