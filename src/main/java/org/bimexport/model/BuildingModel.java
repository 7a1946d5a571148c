package org.bimexport.model;

import java.util.List;

/**
 * 宿主建筑模型的只读查询接口。
 * <p>
 * 实现方在模型不可读时抛出 {@link ModelAccessException}；“查不到”必须返回 null / 空列表，而不是抛异常。
 */
public interface BuildingModel {

    /**
     * 模型中的全部楼层（顺序不保证）。
     */
    List<Level> levels();

    Level findLevel(ElementId id);

    List<PlanView> views();

    List<ModelElement> elements();

    ModelElement findElement(ElementId id);
}
