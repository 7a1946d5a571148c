package org.bimexport.model;

/**
 * 导出时使用的 IFC 实体类型（只列出本服务关心的部分）。
 */
public enum IfcEntityType {
    IfcColumn,
    IfcColumnType,
    IfcWall,
    IfcWallStandardCase,
    IfcWallType,
    IfcBeam,
    IfcBeamType,
    IfcSlab,
    IfcRoof,
    IfcStair,
    IfcDuctSegment,
    IfcDuctSegmentType,
    IfcPipeSegment,
    IfcPipeSegmentType,
    IfcBuildingElementProxy,
    IfcBuildingElementProxyType,
    UnKnown
}
