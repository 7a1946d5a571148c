package org.bimexport.export.dto;

/**
 * {@code bim_split_element} 的返回结果。
 *
 * @param rootId           根目录标识
 * @param path             模型文件路径
 * @param splittingEnabled 配置 app.export.split-walls-and-columns
 * @param levelExtension   使用的楼层边界容差
 * @param element          拆分结果
 */
public record ElementSplitToolResult(
        String rootId,
        String path,
        boolean splittingEnabled,
        double levelExtension,
        ElementSplitResult element
) {
}
