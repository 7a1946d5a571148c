package org.bimexport.model;

/**
 * 构件的导出分类：实例实体类型 + 类型实体类型。
 *
 * @param exportInstance 实例实体类型
 * @param exportType     类型实体类型
 */
public record ExportInfoPair(IfcEntityType exportInstance, IfcEntityType exportType) {

    public static final ExportInfoPair UNKNOWN = new ExportInfoPair(IfcEntityType.UnKnown, IfcEntityType.UnKnown);

    public ExportInfoPair {
        if (exportInstance == null) {
            exportInstance = IfcEntityType.UnKnown;
        }
        if (exportType == null) {
            exportType = IfcEntityType.UnKnown;
        }
    }
}
