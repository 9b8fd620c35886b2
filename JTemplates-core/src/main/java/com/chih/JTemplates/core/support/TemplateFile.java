package com.chih.JTemplates.core.support;

import com.chih.JTemplates.core.exception.TemplateIOException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;

/**
 * 模板文件包装类
 * <p>
 * 一个匹配到的模板文件：磁盘上的绝对位置 + 相对根目录的模板名。
 * 负责读取修改时间和文件内容，所有 IO 失败统一转换为 {@link TemplateIOException}。
 * </p>
 *
 * <h3>设计特点：</h3>
 * <ul>
 *   <li>不可变性：所有字段为 final，线程安全</li>
 *   <li>模板名统一使用 {@code /} 分隔，与操作系统无关</li>
 *   <li>不缓存任何内容，每次调用都访问文件系统</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2025/12/07
 */
public final class TemplateFile {

    /**
     * 最大文件大小限制（10MB）
     * <p>
     * 模板文件通常很小（几KB到几十KB），超过该上限视为选错了文件。
     * </p>
     */
    static final int MAX_FILE_SIZE = 10 * 1024 * 1024;

    private final Path root;

    private final Path path;

    /**
     * 相对根目录的模板名，如 {@code s/b.html}
     */
    private final String name;

    private TemplateFile(Path root, Path path, String name) {
        this.root = root;
        this.path = path;
        this.name = name;
    }

    /**
     * 由根目录下的文件创建
     *
     * @param root 模板根目录
     * @param path 根目录下的文件
     * @return TemplateFile 实例
     * @throws IllegalArgumentException 如果参数为 null
     */
    public static TemplateFile of(Path root, Path path) {
        if (root == null || path == null) {
            throw new IllegalArgumentException("Root and path cannot be null");
        }
        return new TemplateFile(root, path, toTemplateName(root.relativize(path)));
    }

    /**
     * 由模板名创建（用于变更检查时回到磁盘上的文件）
     */
    public static TemplateFile forName(Path root, String name) {
        if (root == null || name == null) {
            throw new IllegalArgumentException("Root and name cannot be null");
        }
        return new TemplateFile(root, root.resolve(name), name);
    }

    /**
     * 读取文件当前的修改时间
     *
     * @throws TemplateIOException 文件不存在或无法访问
     */
    public FileTime readModifiedTime() {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new TemplateIOException(path,
                    String.format("Failed to get file info for template \"%s\", path \"%s\"", name, path), e);
        }
    }

    /**
     * 读取文件内容（UTF-8），带内存保护
     *
     * @throws TemplateIOException 读取失败或文件过大
     */
    public String readContent() {
        try (InputStream is = Files.newInputStream(path)) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            byte[] data = new byte[8192];
            int nRead;
            int totalBytes = 0;

            while ((nRead = is.read(data, 0, data.length)) != -1) {
                totalBytes += nRead;
                if (totalBytes > MAX_FILE_SIZE) {
                    throw new TemplateIOException(path, String.format(
                            "Template file \"%s\" is too large (more than %d bytes)", path, MAX_FILE_SIZE));
                }
                buffer.write(data, 0, nRead);
            }
            return stripBom(buffer.toString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TemplateIOException(path, String.format("Failed to read template file \"%s\"", path), e);
        }
    }

    /**
     * 移除 UTF-8 BOM 头，其余内容原样保留
     */
    static String stripBom(String content) {
        if (content.startsWith("\uFEFF")) {
            return content.substring(1);
        }
        return content;
    }

    private static String toTemplateName(Path relative) {
        // Windows 下也使用 / 作为模板名分隔符
        return relative.toString().replace(relative.getFileSystem().getSeparator(), "/");
    }

    public Path getRoot() {
        return root;
    }

    public Path getPath() {
        return path;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        TemplateFile other = (TemplateFile) obj;
        return Objects.equals(path, other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(path);
    }

    @Override
    public String toString() {
        return "TemplateFile{name='" + name + "', path='" + path + "'}";
    }
}
