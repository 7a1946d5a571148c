package org.bimexport.level;

/**
 * 竖向区间 {@code [start, end]}（模型长度单位），要求 {@code start <= end}。
 * <p>
 * 既用来表示构件的完整竖向范围，也用来表示拆分后的单个片段。
 */
public record VerticalSpan(double start, double end) {

    public VerticalSpan {
        if (Double.isNaN(start) || Double.isNaN(end)) {
            throw new IllegalArgumentException("区间端点不能为 NaN：[" + start + ", " + end + "]");
        }
        if (start > end) {
            throw new IllegalArgumentException("区间起点不能大于终点：[" + start + ", " + end + "]");
        }
    }

    public boolean isEmpty() {
        return !(start < end);
    }
}
