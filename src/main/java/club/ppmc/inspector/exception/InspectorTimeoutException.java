/**
 * InspectorTimeoutException.java
 *
 * 命令或握手在规定时限内没有完成。
 */
package club.ppmc.inspector.exception;

import java.time.Duration;

public class InspectorTimeoutException extends InspectorException {

    public InspectorTimeoutException(String operation, Duration timeout) {
        super("TIMEOUT_ERROR", String.format("%s timed out after %d ms", operation, timeout.toMillis()));
    }
}
