package org.bimexport.model.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bimexport.model.BoundingBox;
import org.bimexport.model.BuildingModel;
import org.bimexport.model.ElementId;
import org.bimexport.model.ElementKind;
import org.bimexport.model.ExportInfoPair;
import org.bimexport.model.IfcEntityType;
import org.bimexport.model.InMemoryBuildingModel;
import org.bimexport.model.Level;
import org.bimexport.model.LevelParameter;
import org.bimexport.model.ModelAccessException;
import org.bimexport.model.ModelElement;
import org.bimexport.model.PlanView;
import org.bimexport.model.ViewType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 建筑模型 JSON 读取器。
 * <p>
 * 约定：
 * <ul>
 *   <li>JSON 结构错误、缺少 id、文件超限等都视为“模型不可读”，抛出 {@link ModelAccessException}。</li>
 *   <li>无法识别的构件类别/视图类型/IFC 类型不报错，分别回退到 OTHER/OTHER/UnKnown，并记录 warn 日志。</li>
 *   <li>{@code levelParameters} 中值为 null 的参数表示“参数存在但没有有效楼层”，与“参数不存在”不同。</li>
 * </ul>
 */
public final class BuildingModelReader {

    private static final Logger log = LoggerFactory.getLogger(BuildingModelReader.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private BuildingModelReader() {
    }

    /**
     * 读取模型文件（UTF-8）。
     *
     * @param file     模型文件
     * @param maxBytes 允许读取的最大字节数；超过则拒绝（不截断，截断后的 JSON 没有意义）
     */
    public static BuildingModel read(Path file, long maxBytes) {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new ModelAccessException("读取模型文件大小失败：" + file, e);
        }
        if (size > maxBytes) {
            throw new ModelAccessException("模型文件过大：" + size + " 字节（上限 " + maxBytes + "）：" + file);
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ModelAccessException("读取模型文件失败：" + file, e);
        }
        BuildingModel model = parse(json);
        log.info("已加载模型 {}：{} 个楼层，{} 个视图，{} 个构件",
                file, model.levels().size(), model.views().size(), model.elements().size());
        return model;
    }

    public static BuildingModel parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ModelAccessException("模型内容为空");
        }
        BuildingModelDocument document;
        try {
            document = OBJECT_MAPPER.readValue(json, BuildingModelDocument.class);
        } catch (JsonProcessingException e) {
            throw new ModelAccessException("模型 JSON 格式错误：" + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new ModelAccessException("模型内容为空");
        }
        try {
            return new InMemoryBuildingModel(
                    toLevels(document.levels()),
                    toViews(document.views()),
                    toElements(document.elements())
            );
        } catch (IllegalArgumentException e) {
            throw new ModelAccessException("模型数据不合法：" + e.getMessage(), e);
        }
    }

    private static List<Level> toLevels(List<BuildingModelDocument.LevelJson> items) {
        List<Level> result = new ArrayList<>();
        if (items == null) {
            return result;
        }
        for (BuildingModelDocument.LevelJson item : items) {
            if (item == null) {
                continue;
            }
            if (item.id() == null) {
                throw new ModelAccessException("楼层缺少 id：" + item.name());
            }
            if (item.elevation() == null) {
                throw new ModelAccessException("楼层缺少标高：" + item.id());
            }
            result.add(new Level(
                    ElementId.of(item.id()),
                    item.name(),
                    item.elevation(),
                    item.buildingStory(),
                    ElementId.ofNullable(item.upToLevel()),
                    item.distanceToNextLevel()
            ));
        }
        return result;
    }

    private static List<PlanView> toViews(List<BuildingModelDocument.ViewJson> items) {
        List<PlanView> result = new ArrayList<>();
        if (items == null) {
            return result;
        }
        for (BuildingModelDocument.ViewJson item : items) {
            if (item == null) {
                continue;
            }
            if (item.id() == null) {
                throw new ModelAccessException("视图缺少 id：" + item.name());
            }
            result.add(new PlanView(
                    ElementId.of(item.id()),
                    item.name(),
                    parseEnum(ViewType.class, item.viewType(), ViewType.OTHER),
                    ElementId.ofNullable(item.genLevel()),
                    ElementId.ofNullable(item.bottomClipLevel())
            ));
        }
        return result;
    }

    private static List<ModelElement> toElements(List<BuildingModelDocument.ElementJson> items) {
        List<ModelElement> result = new ArrayList<>();
        if (items == null) {
            return result;
        }
        for (BuildingModelDocument.ElementJson item : items) {
            if (item == null) {
                continue;
            }
            if (item.id() == null) {
                throw new ModelAccessException("构件缺少 id：" + item.name());
            }
            result.add(new ModelElement(
                    ElementId.of(item.id()),
                    item.name(),
                    parseEnum(ElementKind.class, item.kind(), ElementKind.OTHER),
                    new ExportInfoPair(
                            parseEnum(IfcEntityType.class, item.exportInstance(), IfcEntityType.UnKnown),
                            parseEnum(IfcEntityType.class, item.exportType(), IfcEntityType.UnKnown)
                    ),
                    ElementId.ofNullable(item.level()),
                    Boolean.TRUE.equals(item.viewSpecific()),
                    ElementId.ofNullable(item.ownerView()),
                    ElementId.ofNullable(item.superComponent()),
                    ElementId.ofNullable(item.referenceLevel()),
                    toLevelParameters(item.id(), item.levelParameters()),
                    toOverrides(item.id(), item.overrides()),
                    toBoundingBox(item.boundingBox())
            ));
        }
        return result;
    }

    private static Map<String, String> toOverrides(long elementId, Map<String, String> raw) {
        Map<String, String> result = new LinkedHashMap<>();
        if (raw == null) {
            return result;
        }
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            if (entry.getValue() == null) {
                log.warn("构件 {} 的覆盖参数 {} 没有取值，已忽略", elementId, entry.getKey());
                continue;
            }
            result.put(entry.getKey(), entry.getValue());
        }
        return result;
    }

    private static Map<LevelParameter, ElementId> toLevelParameters(long elementId, Map<String, Long> raw) {
        Map<LevelParameter, ElementId> result = new EnumMap<>(LevelParameter.class);
        if (raw == null) {
            return result;
        }
        for (Map.Entry<String, Long> entry : raw.entrySet()) {
            LevelParameter parameter = parseEnum(LevelParameter.class, entry.getKey(), null);
            if (parameter == null) {
                log.warn("构件 {} 的楼层参数 {} 无法识别，已忽略", elementId, entry.getKey());
                continue;
            }
            result.put(parameter, ElementId.ofNullable(entry.getValue()));
        }
        return result;
    }

    private static BoundingBox toBoundingBox(BuildingModelDocument.BoxJson box) {
        // 没有 Z 范围的包围盒对按楼层拆分没有意义，视为“无包围盒”
        if (box == null || box.minZ() == null || box.maxZ() == null) {
            return null;
        }
        return new BoundingBox(
                orZero(box.minX()),
                orZero(box.minY()),
                box.minZ(),
                orZero(box.maxX()),
                orZero(box.maxY()),
                box.maxZ()
        );
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, E fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim();
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(normalized)) {
                return constant;
            }
        }
        if (fallback != null) {
            log.warn("无法识别的 {} 取值：{}，按 {} 处理", type.getSimpleName(), raw, fallback);
        }
        return fallback;
    }
}
