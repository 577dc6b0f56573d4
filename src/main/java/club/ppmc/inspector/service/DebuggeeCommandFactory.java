/**
 * DebuggeeCommandFactory.java
 *
 * 构造启动被调试脚本的命令行。
 */
package club.ppmc.inspector.service;

import java.nio.file.Path;
import java.util.List;

@FunctionalInterface
public interface DebuggeeCommandFactory {

    List<String> command(String host, int port, boolean breakOnStart, Path script);

    /**
     * node 的标准调试命令：{@code node --inspect[-brk]=host:port script}。
     */
    static DebuggeeCommandFactory node(String executable) {
        return (host, port, breakOnStart, script) -> List.of(
                executable,
                String.format("--inspect%s=%s:%d", breakOnStart ? "-brk" : "", host, port),
                script.toString());
    }
}
