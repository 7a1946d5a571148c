package org.bimexport.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 内存版建筑模型：一次性装入楼层/视图/构件，之后只读。
 * <p>
 * 同一 id 重复出现时抛出 {@link IllegalArgumentException}（id 必须全局唯一）。
 */
public class InMemoryBuildingModel implements BuildingModel {

    private final Map<ElementId, Level> levels;
    private final List<PlanView> views;
    private final Map<ElementId, ModelElement> elements;

    public InMemoryBuildingModel(List<Level> levels, List<PlanView> views, List<ModelElement> elements) {
        this.levels = index(levels, Level::id, "楼层");
        this.views = (views == null) ? List.of() : List.copyOf(views);
        this.elements = index(elements, ModelElement::id, "构件");
    }

    @Override
    public List<Level> levels() {
        return List.copyOf(levels.values());
    }

    @Override
    public Level findLevel(ElementId id) {
        if (id == null || !id.isValid()) {
            return null;
        }
        return levels.get(id);
    }

    @Override
    public List<PlanView> views() {
        return views;
    }

    @Override
    public List<ModelElement> elements() {
        return List.copyOf(elements.values());
    }

    @Override
    public ModelElement findElement(ElementId id) {
        if (id == null || !id.isValid()) {
            return null;
        }
        return elements.get(id);
    }

    private static <T> Map<ElementId, T> index(List<T> items, Function<T, ElementId> idOf, String label) {
        if (items == null || items.isEmpty()) {
            return Map.of();
        }
        Map<ElementId, T> result = new LinkedHashMap<>(items.size() * 2);
        List<ElementId> duplicates = new ArrayList<>();
        for (T item : items) {
            if (item == null) {
                continue;
            }
            ElementId id = idOf.apply(item);
            if (result.putIfAbsent(id, item) != null) {
                duplicates.add(id);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException(label + " id 重复：" + duplicates);
        }
        return Collections.unmodifiableMap(result);
    }
}
