package com.positionledger.mapper;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads snapshot numbers the way the position sync writes them: JSON numbers, the bare
 * {@code NaN}/{@code Infinity} tokens, or numeric strings. Anything else (an unparseable
 * string, a boolean, an object) decodes to null, which the field resolver treats as zero.
 */
class LenientDoubleDeserializer extends StdScalarDeserializer<Double> {

    private static final Logger log = LoggerFactory.getLogger(LenientDoubleDeserializer.class);

    LenientDoubleDeserializer() {
        super(Double.class);
    }

    @Override
    public Double deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return parser.getDoubleValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            return parseText(parser.getText(), parser.currentName());
        }
        if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
            parser.skipChildren();
        }
        log.debug("Non-numeric {} in field {}, read as null", token, parser.currentName());
        return null;
    }

    private static Double parseText(String text, String field) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(trimmed);
        } catch (NumberFormatException e) {
            log.debug("Unparseable number '{}' in field {}, read as null", trimmed, field);
            return null;
        }
    }
}
