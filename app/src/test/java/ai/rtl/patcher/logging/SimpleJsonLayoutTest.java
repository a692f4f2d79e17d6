package ai.rtl.patcher.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private LoggerContext context;
    private SimpleJsonLayout layout;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        context.start();
        layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
    }

    @Test
    void formatsEventAsJson() {
        String json = layout.doLayout(event("assign patch: merged 1", Map.of()));

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"assign patch: merged 1\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"mdc\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void liftsPassNameOutOfMdc() {
        String json = layout.doLayout(event("case patch: inserted 1", Map.of(SimpleJsonLayout.PASS_KEY, "case", "run", "7")));

        assertThat(json).contains("\"logger\":\"test.logger\",\"pass\":\"case\",\"message\"");
        assertThat(json).contains("\"mdc\":{\"run\":\"7\"}");
    }

    @Test
    void escapesControlCharacters() {
        String json = layout.doLayout(event("line \"a\"\n\tb", Map.of()));

        assertThat(json).contains("\"message\":\"line \\\"a\\\"\\n\\tb\"");
    }

    @Test
    void skipsMdcThatCannotBeRead() {
        LoggingEvent event = new LoggingEvent() {
            @Override
            public Map<String, String> getMDCPropertyMap() {
                throw new IllegalStateException("mdc unavailable");
            }
        };
        event.setLevel(Level.WARN);
        event.setLoggerName("test.logger");
        event.setMessage("still logged");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);

        String json = layout.doLayout(event);

        assertThat(json).contains("\"message\":\"still logged\"");
        assertThat(json).doesNotContain("\"pass\"", "\"mdc\"");
    }

    private LoggingEvent event(String message, Map<String, String> mdc) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        event.setMDCPropertyMap(mdc);
        return event;
    }
}
