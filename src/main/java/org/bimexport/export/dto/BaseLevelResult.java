package org.bimexport.export.dto;

/**
 * {@code bim_resolve_base_level} 的返回结果。
 *
 * @param rootId             根目录标识
 * @param path               模型文件路径
 * @param elementId          构件 id
 * @param kind               构件类别
 * @param baseLevelId        底部楼层（无法确定时为 null，拆分将从第一个建筑楼层开始）
 * @param baseLevelName      底部楼层名称
 * @param source             结果来源（VIEW/PARAMETER/MEP_REFERENCE_LEVEL/ELEMENT_LEVEL）
 * @param parameter          命中的楼层参数（仅 source=PARAMETER）
 * @param checkedElementId   实际检查参数的构件（嵌套族为父实例）
 * @param buildingStory      底部楼层是否为建筑楼层（不是时拆分结果为空）
 */
public record BaseLevelResult(
        String rootId,
        String path,
        long elementId,
        String kind,
        Long baseLevelId,
        String baseLevelName,
        String source,
        String parameter,
        long checkedElementId,
        boolean buildingStory
) {
}
