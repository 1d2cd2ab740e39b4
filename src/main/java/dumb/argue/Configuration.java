package dumb.argue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.argue.util.Json;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;

import static dumb.argue.util.Log.debug;
import static dumb.argue.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Engine settings, read from the {@value #RESOURCE} classpath resource when present.
 *
 * @param distinctSupports emit each evidence set for a literal at most once, even when several
 *                         expansion paths produce the same set
 * @param charset          encoding of program files
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Configuration(
        @JsonProperty("distinctSupports") boolean distinctSupports,
        @JsonProperty("charset") String charset
) {
    public static final String RESOURCE = "argue.json";
    public static final boolean DEFAULT_DISTINCT_SUPPORTS = false;
    public static final String DEFAULT_CHARSET = "UTF-8";

    public Configuration {
        requireNonNull(charset, "charset");
        try {
            Charset.forName(charset);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IllegalArgumentException("Unsupported charset: " + charset, e);
        }
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("distinctSupports") Boolean distinctSupports,
            @JsonProperty("charset") String charset
    ) {
        this(
                distinctSupports != null ? distinctSupports : DEFAULT_DISTINCT_SUPPORTS,
                charset != null ? charset : DEFAULT_CHARSET
        );
    }

    public Configuration() {
        this(DEFAULT_DISTINCT_SUPPORTS, DEFAULT_CHARSET);
    }

    public static Configuration parse(String json) throws JsonProcessingException {
        return Json.obj(json, Configuration.class);
    }

    public static Configuration load() {
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) return new Configuration();
            var config = Json.obj(in, Configuration.class);
            debug(String.format("Configuration loaded from %s: distinctSupports=%b, charset=%s", RESOURCE, config.distinctSupports, config.charset));
            return config;
        } catch (IOException e) {
            warning("Failed to read " + RESOURCE + ", using defaults: " + e.getMessage());
            return new Configuration();
        }
    }

    public Charset encoding() {
        return Charset.forName(charset);
    }

    public Configuration withDistinctSupports(boolean distinctSupports) {
        return new Configuration(distinctSupports, charset);
    }
}
