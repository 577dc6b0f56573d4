/**
 * TopicMatcher.java
 *
 * 事件主题匹配器。EventDispatcher 用它判断某个订阅是否接收某个主题的事件。
 */
package club.ppmc.inspector.service;

import java.util.Objects;
import java.util.regex.Pattern;

@FunctionalInterface
public interface TopicMatcher {

    boolean matches(String topic);

    /** 精确匹配，例如 "Debugger.paused"。 */
    static TopicMatcher exact(String topic) {
        Objects.requireNonNull(topic, "topic");
        return topic::equals;
    }

    /** 匹配某个协议域下的所有事件，例如 domain("Debugger") 匹配 "Debugger.paused" 但不匹配 "DebuggerX.y"。 */
    static TopicMatcher domain(String domain) {
        Objects.requireNonNull(domain, "domain");
        String prefix = domain + ".";
        return topic -> topic.startsWith(prefix);
    }

    /** 正则匹配，对主题做部分匹配（find），与 /^Runtime\./ 这类写法一致。 */
    static TopicMatcher regex(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return topic -> pattern.matcher(topic).find();
    }

    /**
     * 通配符匹配：'*' 匹配任意长度字符，其余字符按字面量处理，整体匹配整个主题。
     * 不含 '*' 的模式等价于 {@link #exact(String)}。
     */
    static TopicMatcher glob(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.indexOf('*') < 0) {
            return exact(pattern);
        }
        var regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = pattern.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(pattern.substring(start, star)));
            }
            regex.append(".*");
            start = star + 1;
        }
        if (start < pattern.length()) {
            regex.append(Pattern.quote(pattern.substring(start)));
        }
        Pattern compiled = Pattern.compile(regex.toString());
        return topic -> compiled.matcher(topic).matches();
    }
}
