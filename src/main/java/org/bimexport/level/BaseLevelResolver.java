package org.bimexport.level;

import org.bimexport.model.BuildingModel;
import org.bimexport.model.ElementId;
import org.bimexport.model.ElementKind;
import org.bimexport.model.LevelParameter;
import org.bimexport.model.ModelElement;

import java.util.List;
import java.util.Map;

/**
 * 底部楼层解析：确定构件“锚定”在哪个楼层，作为按楼层拆分的起点。
 * <p>
 * 解析顺序（先命中者为准）：
 * <ol>
 *   <li>视图专有构件：使用所属视图在“视图 -> 楼层”映射中的楼层。</li>
 *   <li>按构件类别的参数优先级列表（见 {@link ElementKind#baseLevelParameters()}）逐个检查，
 *       第一个存在且为有效楼层 id 的参数即为结果。族实例检查的是最外层父实例。</li>
 *   <li>机电线性构件：使用其参照楼层。</li>
 *   <li>最后回退到构件通用的楼层参数（可能为 {@link ElementId#INVALID}，调用方需把它当作“未知”）。</li>
 * </ol>
 * 本类从不因为数据缺失而抛异常。
 */
public class BaseLevelResolver {

    /**
     * 底部楼层的来源，用于诊断输出。
     */
    public enum Source {
        VIEW,
        PARAMETER,
        MEP_REFERENCE_LEVEL,
        ELEMENT_LEVEL
    }

    /**
     * @param levelId   解析结果（可能为 {@link ElementId#INVALID}）
     * @param source    结果来源
     * @param parameter 命中的参数（仅 {@link Source#PARAMETER} 时非空）
     * @param checkedElementId 实际检查参数的构件（嵌套族时为父实例）
     */
    public record Resolution(ElementId levelId, Source source, LevelParameter parameter, ElementId checkedElementId) {
    }

    private final BuildingModel model;
    private final Map<ElementId, ElementId> viewLevels;

    /**
     * @param model      宿主模型
     * @param viewLevels 视图 id -> 楼层 id（本次导出涉及的平面视图）
     */
    public BaseLevelResolver(BuildingModel model, Map<ElementId, ElementId> viewLevels) {
        this.model = model;
        this.viewLevels = (viewLevels == null) ? Map.of() : Map.copyOf(viewLevels);
    }

    public ElementId resolveBaseLevel(ModelElement element) {
        return resolve(element).levelId();
    }

    public Resolution resolve(ModelElement element) {
        if (element.viewSpecific()) {
            ElementId viewLevelId = viewLevels.get(element.ownerViewId());
            if (viewLevelId != null) {
                return new Resolution(viewLevelId, Source.VIEW, null, element.id());
            }
        }

        ModelElement elementToCheck = element;
        if (element.kind().isFamilyInstance()) {
            ModelElement superComponent = model.findElement(element.superComponentId());
            if (superComponent != null) {
                elementToCheck = superComponent;
            }
        }

        Resolution byParameter = firstValidLevel(elementToCheck, element.kind().baseLevelParameters());
        if (byParameter != null) {
            return byParameter;
        }

        if (element.kind() == ElementKind.MEP_CURVE && element.referenceLevelId().isValid()) {
            return new Resolution(element.referenceLevelId(), Source.MEP_REFERENCE_LEVEL, null, element.id());
        }

        return new Resolution(element.levelId(), Source.ELEMENT_LEVEL, null, element.id());
    }

    private static Resolution firstValidLevel(ModelElement element, List<LevelParameter> parameters) {
        for (LevelParameter parameter : parameters) {
            ElementId levelId = element.levelParameter(parameter);
            if (levelId != null && levelId.isValid()) {
                return new Resolution(levelId, Source.PARAMETER, parameter, element.id());
            }
        }
        return null;
    }
}
