package org.bimexport.export.dto;

/**
 * 拆分片段。
 *
 * @param levelId   所属楼层
 * @param levelName 楼层名称
 * @param start     区间起点
 * @param end       区间终点
 */
public record FragmentEntry(
        long levelId,
        String levelName,
        double start,
        double end
) {
}
