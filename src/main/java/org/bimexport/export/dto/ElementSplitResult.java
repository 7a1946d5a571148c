package org.bimexport.export.dto;

import java.util.List;

/**
 * 单个构件的按楼层拆分结果。
 *
 * @param elementId       构件 id
 * @param name            构件名称
 * @param exportInstance  使用的实例实体类型
 * @param exportType      使用的类型实体类型
 * @param splitByLevel    该导出分类是否参与按楼层拆分
 * @param zStart          包围盒 Z 最小值（无包围盒为 null）
 * @param zEnd            包围盒 Z 最大值（无包围盒为 null）
 * @param compositionType 组合类型（COMPLEX/ELEMENT/PARTIAL）
 * @param fragments       片段（按起点升序，互不重叠；为空表示不拆分）
 */
public record ElementSplitResult(
        long elementId,
        String name,
        String exportInstance,
        String exportType,
        boolean splitByLevel,
        Double zStart,
        Double zEnd,
        String compositionType,
        List<FragmentEntry> fragments
) {
}
