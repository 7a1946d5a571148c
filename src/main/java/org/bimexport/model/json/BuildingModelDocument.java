package org.bimexport.model.json;

import java.util.List;
import java.util.Map;

/**
 * 模型 JSON 文件的原始结构（与文件字段一一对应，尚未做任何校验/转换）。
 * <p>
 * 文件示例：
 * <pre>
 * {
 *   "levels":   [{"id": 1, "name": "F1", "elevation": 0.0, "upToLevel": 2}],
 *   "views":    [{"id": 100, "viewType": "FLOOR_PLAN", "genLevel": 1, "bottomClipLevel": 1}],
 *   "elements": [{"id": 1000, "kind": "WALL", "exportInstance": "IfcWall",
 *                 "levelParameters": {"WALL_BASE_CONSTRAINT": 1},
 *                 "boundingBox": {"minZ": 0.0, "maxZ": 20.0}}]
 * }
 * </pre>
 */
record BuildingModelDocument(
        List<LevelJson> levels,
        List<ViewJson> views,
        List<ElementJson> elements
) {

    record LevelJson(
            Long id,
            String name,
            Double elevation,
            Boolean buildingStory,
            Long upToLevel,
            Double distanceToNextLevel
    ) {
    }

    record ViewJson(
            Long id,
            String name,
            String viewType,
            Long genLevel,
            Long bottomClipLevel
    ) {
    }

    record ElementJson(
            Long id,
            String name,
            String kind,
            String exportInstance,
            String exportType,
            Long level,
            Boolean viewSpecific,
            Long ownerView,
            Long superComponent,
            Long referenceLevel,
            Map<String, Long> levelParameters,
            Map<String, String> overrides,
            BoxJson boundingBox
    ) {
    }

    record BoxJson(
            Double minX,
            Double minY,
            Double minZ,
            Double maxX,
            Double maxY,
            Double maxZ
    ) {
    }
}
