package club.ppmc.inspector.service;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class TopicMatcherTest {

    @Test
    void exactMatchesOnlyTheSameTopic() {
        TopicMatcher matcher = TopicMatcher.exact("Debugger.paused");
        assertTrue(matcher.matches("Debugger.paused"));
        assertFalse(matcher.matches("Debugger.pausedX"));
        assertFalse(matcher.matches("Debugger.resumed"));
    }

    @Test
    void domainMatcherRequiresTheDotSeparator() {
        TopicMatcher matcher = TopicMatcher.domain("Debugger");
        assertTrue(matcher.matches("Debugger.paused"));
        assertTrue(matcher.matches("Debugger.scriptParsed"));
        assertFalse(matcher.matches("DebuggerX.paused"));
        assertFalse(matcher.matches("Runtime.consoleAPICalled"));
    }

    @Test
    void globTreatsDotsLiterally() {
        TopicMatcher matcher = TopicMatcher.glob("Debugger.*");
        assertTrue(matcher.matches("Debugger.paused"));
        assertFalse(matcher.matches("DebuggerXpaused"));
        assertFalse(matcher.matches("Runtime.consoleAPICalled"));
    }

    @Test
    void globWithStarInTheMiddle() {
        TopicMatcher matcher = TopicMatcher.glob("*.enable");
        assertTrue(matcher.matches("Runtime.enable"));
        assertTrue(matcher.matches("HeapProfiler.enable"));
        assertFalse(matcher.matches("Runtime.enabled"));
    }

    @Test
    void globWithoutStarIsExact() {
        TopicMatcher matcher = TopicMatcher.glob("Proxy.ready");
        assertTrue(matcher.matches("Proxy.ready"));
        assertFalse(matcher.matches("Proxy.readyX"));
    }

    @Test
    void regexUsesFindSemantics() {
        TopicMatcher matcher = TopicMatcher.regex(Pattern.compile("^Runtime\\."));
        assertTrue(matcher.matches("Runtime.exceptionThrown"));
        assertFalse(matcher.matches("Debugger.paused"));

        TopicMatcher anywhere = TopicMatcher.regex(Pattern.compile("paused|resumed"));
        assertTrue(anywhere.matches("Debugger.resumed"));
    }
}
