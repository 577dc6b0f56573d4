/**
 * WorkspacePathValidator.java
 *
 * 工作区边界检查。将客户端提交的相对路径解析为工作区内的绝对路径，
 * 解析时跟随符号链接，结果落在工作区根目录之外则视为路径穿越。
 */
package club.ppmc.inspector.util;

import club.ppmc.inspector.config.InspectorSettings;
import club.ppmc.inspector.exception.PathViolationException;
import club.ppmc.inspector.exception.TargetNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class WorkspacePathValidator {

    private final Path workspaceRoot;

    @Autowired
    public WorkspacePathValidator(InspectorSettings settings) {
        this(Paths.get(settings.getWorkspaceRoot()));
    }

    public WorkspacePathValidator(Path workspaceRoot) {
        Path absolute = workspaceRoot.toAbsolutePath().normalize();
        Path resolved;
        try {
            resolved = absolute.toRealPath();
        } catch (IOException e) {
            // 工作区目录尚不存在时使用规范化后的绝对路径
            log.warn("工作区根目录 {} 无法解析为真实路径: {}", absolute, e.getMessage());
            resolved = absolute;
        }
        this.workspaceRoot = resolved;
        log.info("工作区根目录: {}", this.workspaceRoot);
    }

    /**
     * 将相对路径解析为工作区内的绝对路径。目标不必存在。
     *
     * @throws IllegalArgumentException 路径为空。
     * @throws PathViolationException 路径逃出了工作区。
     */
    public Path resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("Missing required field: file");
        }
        // "/src/app.js" 与 "src/app.js" 一样相对于工作区根目录
        String trimmed = relativePath.replaceFirst("^[/\\\\]+", "");

        Path candidate;
        try {
            candidate = workspaceRoot.resolve(trimmed).normalize();
        } catch (InvalidPathException e) {
            throw new PathViolationException(relativePath);
        }

        Path resolved = followLinks(relativePath, candidate);
        if (!resolved.startsWith(workspaceRoot)) {
            log.warn("拒绝访问工作区之外的路径: {} -> {}", relativePath, resolved);
            throw new PathViolationException(relativePath);
        }
        return resolved;
    }

    /**
     * 解析路径并要求其为已存在的普通文件。
     *
     * @throws TargetNotFoundException 文件不存在。
     */
    public Path requireFile(String relativePath) {
        Path resolved = resolve(relativePath);
        if (!Files.isRegularFile(resolved)) {
            throw new TargetNotFoundException(relativePath);
        }
        return resolved;
    }

    public boolean isWithinWorkspace(Path absolutePath) {
        return absolutePath.toAbsolutePath().normalize().startsWith(workspaceRoot);
    }

    public String relativize(Path absolutePath) {
        return workspaceRoot.relativize(absolutePath).toString();
    }

    private static Path followLinks(String requestedPath, Path candidate) {
        try {
            if (Files.exists(candidate)) {
                return candidate.toRealPath();
            }
            Path parent = candidate.getParent();
            if (parent != null && Files.exists(parent)) {
                return parent.toRealPath().resolve(candidate.getFileName());
            }
            return candidate;
        } catch (IOException e) {
            log.warn("无法解析路径 {}: {}", candidate, e.getMessage());
            throw new PathViolationException(requestedPath, e);
        }
    }
}
