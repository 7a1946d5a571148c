package org.bimexport.export.dto;

import java.util.List;

/**
 * {@code bim_list_levels} 的返回结果。
 *
 * @param rootId             根目录标识
 * @param path               模型文件路径（相对 root，使用 '/' 分隔）
 * @param levels             按标高排序的全部楼层（标高相同按 id 升序）
 * @param buildingStoryCount 建筑楼层数量
 */
public record LevelCatalogResult(
        String rootId,
        String path,
        List<LevelEntry> levels,
        int buildingStoryCount
) {
}
