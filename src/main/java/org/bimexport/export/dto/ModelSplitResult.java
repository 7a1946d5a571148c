package org.bimexport.export.dto;

import java.util.List;

/**
 * {@code bim_split_model} 的返回结果（同一次导出过程内处理全部构件）。
 *
 * @param rootId            根目录标识
 * @param path              模型文件路径
 * @param splittingEnabled  配置 app.export.split-walls-and-columns
 * @param levelExtension    使用的楼层边界容差
 * @param elementsTotal     模型中的构件总数
 * @param elementsProcessed 实际处理的构件数
 * @param truncated         是否因 maxElements 提前停止
 * @param elementsSplit     拆分出至少一段的构件数
 * @param elements          拆分出至少一段的构件
 * @param levelInfos        导出过程结束时的楼层信息缓存
 */
public record ModelSplitResult(
        String rootId,
        String path,
        boolean splittingEnabled,
        double levelExtension,
        int elementsTotal,
        int elementsProcessed,
        boolean truncated,
        int elementsSplit,
        List<ElementSplitResult> elements,
        List<LevelInfoEntry> levelInfos
) {
}
