package com.example.i18n.web;

import com.example.i18n.response.Envelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Serializes envelopes in every {@link ResponseFormat}, all as UTF-8.
 * JSON goes through the application's {@link ObjectMapper}; the XML and YAML
 * mappers pick up every Jackson module on the classpath and write dates as ISO strings.
 */
public class EnvelopeWriter {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeWriter.class);

    /** Dotted JavaScript identifier path, e.g. {@code cb} or {@code app.handlers.cb}. */
    private static final Pattern CALLBACK = Pattern.compile("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*");

    private final ObjectWriter pureJson;
    private final ObjectWriter htmlSafeJson;
    private final ObjectWriter asciiJson;
    private final ObjectWriter xml;
    private final ObjectWriter yaml;

    public EnvelopeWriter(ObjectMapper objectMapper) {
        this.pureJson = objectMapper.writer();
        this.htmlSafeJson = pureJson.with(new HtmlCharacterEscapes());
        this.asciiJson = htmlSafeJson.with(JsonWriteFeature.ESCAPE_NON_ASCII);
        this.xml = XmlMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
                .build()
                .writer();
        this.yaml = YAMLMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build()
                .writer();
    }

    /**
     * @param callback JSONP callback name, only used for {@link ResponseFormat#JSONP}; may be null
     */
    public byte[] write(ResponseFormat format, Envelope envelope, String callback) throws JsonProcessingException {
        switch (format) {
            case PURE_JSON:
                return pureJson.writeValueAsBytes(envelope);
            case ASCII_JSON:
                return asciiJson.writeValueAsBytes(envelope);
            case JSONP:
                return jsonp(envelope, callback);
            case XML:
                return xml.writeValueAsBytes(envelope);
            case YAML:
                return yaml.writeValueAsBytes(envelope);
            case JSON:
            default:
                return htmlSafeJson.writeValueAsBytes(envelope);
        }
    }

    private byte[] jsonp(Envelope envelope, String callback) throws JsonProcessingException {
        String json = htmlSafeJson.writeValueAsString(envelope);
        if (callback == null || callback.isEmpty()) {
            return json.getBytes(StandardCharsets.UTF_8);
        }
        if (!CALLBACK.matcher(callback).matches()) {
            log.warn("Rejected JSONP callback name {}, writing plain JSON", callback);
            return json.getBytes(StandardCharsets.UTF_8);
        }
        return (callback + "(" + json + ");").getBytes(StandardCharsets.UTF_8);
    }
}
