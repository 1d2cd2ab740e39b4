package dumb.argue;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.argue.util.Json;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationTests {

    @Test
    void defaults() {
        var config = new Configuration();
        assertFalse(config.distinctSupports());
        assertEquals(StandardCharsets.UTF_8, config.encoding());
    }

    @Test
    void missingFieldsTakeDefaults() throws JsonProcessingException {
        var config = Configuration.parse("{\"distinctSupports\": true}");
        assertTrue(config.distinctSupports());
        assertEquals(Configuration.DEFAULT_CHARSET, config.charset());
        assertEquals(new Configuration(), Configuration.parse("{}"));
    }

    @Test
    void roundTripThroughJson() throws JsonProcessingException {
        var config = new Configuration(true, "ISO-8859-1");
        assertEquals(config, Configuration.parse(Json.str(config)));
    }

    @Test
    void unsupportedCharsetIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Configuration(false, "no-such-charset"));
    }

    @Test
    void classpathResource() {
        assertEquals(new Configuration(), Configuration.load());
    }

    @Test
    void knowledgeBaseKeepsItsConfiguration() throws LogicParser.ParseException {
        var config = new Configuration().withDistinctSupports(true);
        var kb = KnowledgeBase.of(Source.text("a."), config);
        assertSame(config, kb.config());
    }
}
