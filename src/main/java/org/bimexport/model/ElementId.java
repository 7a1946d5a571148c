package org.bimexport.model;

/**
 * 宿主模型中的元素标识（Level、View、构件共用同一套 id 空间）。
 * <p>
 * 说明：
 * <ul>
 *   <li>{@link #INVALID} 表示“无效/未设置”，所有“找不到”的情况都用它表示，而不是抛异常。</li>
 *   <li>自然顺序按数值升序；标高相同的楼层按此顺序排序，保证排序结果确定。</li>
 * </ul>
 *
 * @param value 数值 id
 */
public record ElementId(long value) implements Comparable<ElementId> {

    public static final ElementId INVALID = new ElementId(-1L);

    public static ElementId of(long value) {
        return new ElementId(value);
    }

    /**
     * 把可能为 null 的 JSON 数值转换为 id（null 视为 {@link #INVALID}）。
     */
    public static ElementId ofNullable(Long value) {
        return value == null ? INVALID : new ElementId(value);
    }

    public boolean isValid() {
        return value != INVALID.value;
    }

    @Override
    public int compareTo(ElementId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
