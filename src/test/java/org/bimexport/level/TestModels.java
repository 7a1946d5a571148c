package org.bimexport.level;

import org.bimexport.model.BoundingBox;
import org.bimexport.model.ElementId;
import org.bimexport.model.ElementKind;
import org.bimexport.model.ExportInfoPair;
import org.bimexport.model.IfcEntityType;
import org.bimexport.model.InMemoryBuildingModel;
import org.bimexport.model.Level;
import org.bimexport.model.LevelParameter;
import org.bimexport.model.ModelElement;
import org.bimexport.model.PlanView;

import java.util.List;
import java.util.Map;

/**
 * 测试用的模型构造工具。
 */
final class TestModels {

    static final ExportInfoPair COLUMN = new ExportInfoPair(IfcEntityType.IfcColumn, IfcEntityType.IfcColumnType);
    static final ExportInfoPair WALL = new ExportInfoPair(IfcEntityType.IfcWall, IfcEntityType.IfcWallType);
    static final ExportInfoPair DUCT = new ExportInfoPair(IfcEntityType.IfcDuctSegment, IfcEntityType.IfcDuctSegmentType);
    static final ExportInfoPair BEAM = new ExportInfoPair(IfcEntityType.IfcBeam, IfcEntityType.IfcBeamType);

    private TestModels() {
    }

    static ElementId id(long value) {
        return ElementId.of(value);
    }

    static Level story(long id, double elevation) {
        return new Level(id(id), "L" + id, elevation, true, ElementId.INVALID, null);
    }

    static Level story(long id, double elevation, long upToLevel) {
        return new Level(id(id), "L" + id, elevation, true, id(upToLevel), null);
    }

    static Level storyWithDefaultHeight(long id, double elevation, double defaultHeight) {
        return new Level(id(id), "L" + id, elevation, true, ElementId.INVALID, defaultHeight);
    }

    static Level nonStory(long id, double elevation) {
        return new Level(id(id), "R" + id, elevation, false, ElementId.INVALID, null);
    }

    static ModelElement element(long id, ElementKind kind, ExportInfoPair exportInfo, double zMin, double zMax) {
        return element(id, kind, exportInfo, ElementId.INVALID, Map.of(), zMin, zMax);
    }

    static ModelElement element(
            long id,
            ElementKind kind,
            ExportInfoPair exportInfo,
            ElementId levelId,
            Map<LevelParameter, ElementId> parameters,
            double zMin,
            double zMax
    ) {
        return new ModelElement(
                id(id), "E" + id, kind, exportInfo, levelId,
                false, ElementId.INVALID, ElementId.INVALID, ElementId.INVALID,
                parameters, Map.of(), new BoundingBox(0, 0, zMin, 1, 1, zMax)
        );
    }

    static InMemoryBuildingModel model(List<Level> levels, ModelElement... elements) {
        return new InMemoryBuildingModel(levels, List.of(), List.of(elements));
    }

    static InMemoryBuildingModel model(List<Level> levels, List<PlanView> views, List<ModelElement> elements) {
        return new InMemoryBuildingModel(levels, views, elements);
    }
}
