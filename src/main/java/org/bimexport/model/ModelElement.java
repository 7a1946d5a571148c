package org.bimexport.model;

import java.util.Map;

/**
 * 宿主模型中的构件（只读快照）。
 *
 * @param id                 构件 id
 * @param name               构件名称
 * @param kind               构件类别（决定底部楼层的查找策略）
 * @param exportInfo         导出分类（决定是否按楼层拆分）
 * @param levelId            构件通用的“楼层”参数（可能为 {@link ElementId#INVALID}）
 * @param viewSpecific       是否为视图专有构件（例如详图构件）
 * @param ownerViewId        视图专有构件所属视图
 * @param superComponentId   嵌套族的父实例（无则为 {@link ElementId#INVALID}）
 * @param referenceLevelId   机电线性构件的参照楼层（无则为 {@link ElementId#INVALID}）
 * @param levelParameters    值为楼层 id 的内置参数；未出现的 key 表示构件没有该参数
 * @param overrides          文本型覆盖参数（例如 IfcElementCompositionType）
 * @param boundingBox        包围盒（可能为 null）
 */
public record ModelElement(
        ElementId id,
        String name,
        ElementKind kind,
        ExportInfoPair exportInfo,
        ElementId levelId,
        boolean viewSpecific,
        ElementId ownerViewId,
        ElementId superComponentId,
        ElementId referenceLevelId,
        Map<LevelParameter, ElementId> levelParameters,
        Map<String, String> overrides,
        BoundingBox boundingBox
) {
    public ModelElement {
        if (id == null) {
            throw new IllegalArgumentException("构件 id 不能为空");
        }
        kind = (kind == null) ? ElementKind.OTHER : kind;
        exportInfo = (exportInfo == null) ? ExportInfoPair.UNKNOWN : exportInfo;
        levelId = (levelId == null) ? ElementId.INVALID : levelId;
        ownerViewId = (ownerViewId == null) ? ElementId.INVALID : ownerViewId;
        superComponentId = (superComponentId == null) ? ElementId.INVALID : superComponentId;
        referenceLevelId = (referenceLevelId == null) ? ElementId.INVALID : referenceLevelId;
        levelParameters = (levelParameters == null) ? Map.of() : Map.copyOf(levelParameters);
        overrides = (overrides == null) ? Map.of() : Map.copyOf(overrides);
    }

    /**
     * 读取值为楼层 id 的参数；参数不存在时返回 null（与“参数存在但值无效”区分开）。
     */
    public ElementId levelParameter(LevelParameter parameter) {
        return levelParameters.get(parameter);
    }

    /**
     * 读取文本覆盖参数（名称不区分大小写）。
     */
    public String override(String name) {
        if (name == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
