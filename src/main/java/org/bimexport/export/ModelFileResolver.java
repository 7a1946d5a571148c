package org.bimexport.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 模型文件路径解析器：把调用方传入的路径解析成根目录白名单内的绝对路径。
 * <p>
 * 规则：
 * <ul>
 *   <li>相对路径从 rootId 指定的根目录解析（rootId 为空时使用 root0）。</li>
 *   <li>绝对路径自动匹配层级最深的根目录。</li>
 *   <li>拒绝 {@code ../} 穿越；默认拒绝符号链接，并用 realPath 校验 junction 逃逸。</li>
 *   <li>目标必须是已存在的普通文件。</li>
 * </ul>
 */
public class ModelFileResolver {

    private final List<Root> roots;
    private final boolean allowSymlink;

    public ModelFileResolver(List<String> configuredRoots, boolean allowSymlink) {
        this.roots = normalizeRoots(configuredRoots);
        this.allowSymlink = allowSymlink;
    }

    public ResolvedPath resolve(String rootId, String inputPath) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.export.roots）");
        }
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("参数错误：path 不能为空");
        }

        Path rawPath = Path.of(inputPath);
        Root selectedRoot;
        Path absolute;
        if (rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }
        validateWithinRoot(selectedRoot, absolute);
        if (!Files.isRegularFile(absolute, LinkOption.NOFOLLOW_LINKS) && !(allowSymlink && Files.isRegularFile(absolute))) {
            throw new IllegalArgumentException("不是普通文件：" + displayPath(selectedRoot, absolute));
        }
        return new ResolvedPath(selectedRoot.id(), absolute, displayPath(selectedRoot, absolute));
    }

    private void validateWithinRoot(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }
        if (!Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + displayPath(root, absolute));
        }

        // 逐级检查，防止中间某一级目录是链接
        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!allowSymlink && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
        }

        Path realTarget;
        try {
            realTarget = absolute.toRealPath();
        } catch (IOException e) {
            throw new IllegalArgumentException("路径无法解析：" + absolute, e);
        }
        if (!realTarget.startsWith(rootReal)) {
            throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + absolute);
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.export.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        return root.rootPath().relativize(absolute).toString().replace('\\', '/');
    }

    private record Root(String id, Path rootPath) {
    }

    public record ResolvedPath(String rootId, Path absolutePath, String displayPath) {
    }
}
