package org.bimexport.export;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.bimexport.level.ExportOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * 按楼层拆分服务的配置（{@code app.export.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许读取模型文件的根目录白名单。</li>
 *   <li>{@link #splitWallsAndColumns} 与 {@link #levelExtension} 在每次导出开始时读取一次，组成 {@link ExportOptions}。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.export")
public class LevelSplitProperties {

    /**
     * 允许读取模型文件的根目录白名单，依次分配 rootId（root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许通过符号链接/junction 访问模型文件（默认不允许，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    /**
     * 模型 JSON 文件的最大字节数（超过则拒绝读取）。
     */
    @NotNull
    private DataSize modelMaxBytes = DataSize.ofMegabytes(64);

    /**
     * 是否按楼层拆分墙、柱与风管。
     */
    private boolean splitWallsAndColumns = true;

    /**
     * 楼层边界容差（模型长度单位，默认 10cm 对应的英尺数）。
     */
    @DecimalMin("0.0")
    private double levelExtension = ExportOptions.DEFAULT_LEVEL_EXTENSION;

    /**
     * {@code bim_split_model} 默认最多处理的构件数。
     */
    @Min(1)
    @Max(10_000_000)
    private int splitModelDefaultMaxElements = 10_000;

    /**
     * {@code bim_split_model} 允许的最大构件数（上限保护）。
     */
    @Min(1)
    @Max(10_000_000)
    private int splitModelMaxElements = 200_000;

    public ExportOptions toExportOptions() {
        return new ExportOptions(splitWallsAndColumns, levelExtension);
    }

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public DataSize getModelMaxBytes() {
        return modelMaxBytes;
    }

    public void setModelMaxBytes(DataSize modelMaxBytes) {
        this.modelMaxBytes = modelMaxBytes;
    }

    public boolean isSplitWallsAndColumns() {
        return splitWallsAndColumns;
    }

    public void setSplitWallsAndColumns(boolean splitWallsAndColumns) {
        this.splitWallsAndColumns = splitWallsAndColumns;
    }

    public double getLevelExtension() {
        return levelExtension;
    }

    public void setLevelExtension(double levelExtension) {
        this.levelExtension = levelExtension;
    }

    public int getSplitModelDefaultMaxElements() {
        return splitModelDefaultMaxElements;
    }

    public void setSplitModelDefaultMaxElements(int splitModelDefaultMaxElements) {
        this.splitModelDefaultMaxElements = splitModelDefaultMaxElements;
    }

    public int getSplitModelMaxElements() {
        return splitModelMaxElements;
    }

    public void setSplitModelMaxElements(int splitModelMaxElements) {
        this.splitModelMaxElements = splitModelMaxElements;
    }
}
