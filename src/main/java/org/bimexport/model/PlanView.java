package org.bimexport.model;

/**
 * 宿主模型中的视图。
 *
 * @param id               视图 id
 * @param name             视图名称
 * @param viewType         视图类型
 * @param genLevelId       生成该视图的楼层（无则为 {@link ElementId#INVALID}）
 * @param bottomClipLevelId 视图范围底部裁剪面所参照的楼层（无则为 {@link ElementId#INVALID}）
 */
public record PlanView(
        ElementId id,
        String name,
        ViewType viewType,
        ElementId genLevelId,
        ElementId bottomClipLevelId
) {
    public PlanView {
        if (genLevelId == null) {
            genLevelId = ElementId.INVALID;
        }
        if (bottomClipLevelId == null) {
            bottomClipLevelId = ElementId.INVALID;
        }
    }
}
