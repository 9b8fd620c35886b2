package com.chih.JTemplates.core.support;

import com.chih.JTemplates.core.exception.TemplatePatternException;
import com.chih.JTemplates.core.exception.TemplateTraversalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 模板文件扫描器
 * <p>
 * 递归遍历根目录，按文件名（不含目录部分）匹配 glob 模式，返回所有命中的普通文件。
 * </p>
 * <ul>
 *   <li>模式语法与 {@link FileSystem#getPathMatcher(String)} 的 {@code glob:} 一致</li>
 *   <li>模式只作用于文件名，无法匹配目录结构</li>
 *   <li>同一目录内按文件名排序、深度优先，结果顺序稳定</li>
 *   <li>指向文件的符号链接会被收录，指向目录的符号链接不会进入</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2025/12/07
 */
public final class TemplateFileScanner {

    private static final Logger log = LoggerFactory.getLogger(TemplateFileScanner.class);

    private final Path root;
    private final List<String> patterns;
    private final List<PathMatcher> matchers;

    /**
     * @throws TemplatePatternException 任意一个模式语法错误
     */
    public TemplateFileScanner(Path root, List<String> patterns) {
        this.root = root;
        this.patterns = patterns;
        this.matchers = compilePatterns(root, patterns);
    }

    private static List<PathMatcher> compilePatterns(Path root, List<String> patterns) {
        FileSystem fileSystem = root.getFileSystem();
        List<PathMatcher> result = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            try {
                result.add(fileSystem.getPathMatcher("glob:" + pattern));
            } catch (IllegalArgumentException e) {
                // PatternSyntaxException 也是 IllegalArgumentException
                throw new TemplatePatternException(pattern, root, patterns, e);
            }
        }
        return result;
    }

    /**
     * 扫描根目录
     *
     * @return 命中的模板文件，按遍历顺序
     * @throws TemplateTraversalException 根目录不存在、不是目录或遍历中途失败
     */
    public List<TemplateFile> scan() {
        if (!Files.isDirectory(root)) {
            throw new TemplateTraversalException(root, patterns, "not a directory", null);
        }
        List<TemplateFile> files = new ArrayList<>();
        scanDirectory(root, files);
        return files;
    }

    private void scanDirectory(Path directory, List<TemplateFile> files) {
        List<Path> children;
        try (Stream<Path> stream = Files.list(directory)) {
            children = stream
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            // Files.list 在迭代中出错时抛 UncheckedIOException
            throw new TemplateTraversalException(root, patterns,
                    "failed to list directory \"" + directory + "\"", e);
        }

        for (Path child : children) {
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                scanDirectory(child, files);
            } else if (Files.isRegularFile(child) && matches(child.getFileName())) {
                TemplateFile file = TemplateFile.of(root, child);
                log.debug("Found template file: {}", file.getName());
                files.add(file);
            }
        }
    }

    /**
     * 按顺序尝试每个模式，命中第一个即返回
     */
    boolean matches(Path fileName) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }

    public Path getRoot() {
        return root;
    }

    public List<String> getPatterns() {
        return patterns;
    }
}
