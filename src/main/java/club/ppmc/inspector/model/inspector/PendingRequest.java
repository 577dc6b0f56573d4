/**
 * PendingRequest.java
 *
 * 一条已发往上游、尚未得到响应的命令。
 * 在收到匹配的响应、超时或连接断开时被移除，id 永不复用。
 */
package club.ppmc.inspector.model.inspector;

import com.google.gson.JsonObject;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * @param messageId 全局唯一、严格递增的消息 ID。
 * @param method 完整的方法名，例如 "Runtime.evaluate"。
 * @param params 命令参数。
 * @param createdAt 创建时间。
 * @param completion 命令结果的完成句柄。
 * @param deadline 超时截止时间。
 */
public record PendingRequest(
        long messageId,
        String method,
        JsonObject params,
        Instant createdAt,
        CompletableFuture<JsonObject> completion,
        Instant deadline) {

    public String domain() {
        int dot = method.indexOf('.');
        return dot < 0 ? method : method.substring(0, dot);
    }
}
