/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.values;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import oracle.nosql.cursor.JsonParseException;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

/**
 * @hidden
 * Conversion between JSON text and {@link Document}, using the Jackson
 * streaming parser and generator.
 */
public class JsonUtils {

    protected static final JsonFactory factory = new JsonFactory();

    /**
     * Parses a JSON object into a Document. Field order is preserved.
     */
    static Document parseDocument(String jsonInput) {
        if (jsonInput == null) {
            throw new IllegalArgumentException(
                "JSON input must be non-null");
        }
        try (JsonParser jp = factory.createParser(jsonInput)) {
            return readDocument(jp);
        } catch (IOException ioe) {
            throw new JsonParseException(
                "Failed to parse JSON input: " + ioe.getMessage(), null);
        }
    }

    private static Document readDocument(JsonParser jp) {
        try {
            JsonToken token = jp.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw createParseException(
                    "JSON input is not an object: " + token, jp);
            }
            Document doc = parseObject(jp);
            if (jp.nextToken() != null) {
                throw createParseException(
                    "Unexpected content after JSON object", jp);
            }
            return doc;
        } catch (IOException ioe) {
            throw createParseException(
                "Failed to parse JSON input: " + ioe.getMessage(), jp);
        }
    }

    /*
     * The current token is a value token; the token has already been read
     */
    private static Object parseValue(JsonParser jp, JsonToken token)
        throws IOException {

        if (token == null) {
            throw createParseException("Unexpected end of JSON input", jp);
        }
        switch (token) {
        case VALUE_STRING:
            return jp.getText();
        case VALUE_NUMBER_INT:
            switch (jp.getNumberType()) {
            case INT:
                return jp.getIntValue();
            case LONG:
                return jp.getLongValue();
            default:
                return jp.getDecimalValue();
            }
        case VALUE_NUMBER_FLOAT:
            double dbl = jp.getDoubleValue();
            if (Double.isInfinite(dbl)) {
                return jp.getDecimalValue();
            }
            return dbl;
        case VALUE_TRUE:
            return Boolean.TRUE;
        case VALUE_FALSE:
            return Boolean.FALSE;
        case VALUE_NULL:
            return null;
        case START_OBJECT:
            return parseObject(jp);
        case START_ARRAY:
            return parseArray(jp);
        default:
            throw createParseException(
                "Unexpected token while parsing JSON: " + token, jp);
        }
    }

    private static Document parseObject(JsonParser jp) throws IOException {
        Document doc = new Document();
        JsonToken token;
        while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
            String fieldName = jp.currentName();
            if (token == null || fieldName == null) {
                throw createParseException(
                    "null token or field name parsing JSON object", jp);
            }
            doc.put(fieldName, parseValue(jp, jp.nextToken()));
        }
        return doc;
    }

    private static List<Object> parseArray(JsonParser jp) throws IOException {
        List<Object> array = new ArrayList<Object>();
        JsonToken token;
        while ((token = jp.nextToken()) != JsonToken.END_ARRAY) {
            array.add(parseValue(jp, token));
        }
        return array;
    }

    /**
     * Writes a Document as compact JSON.
     */
    static String toJson(Document doc) {
        StringWriter sw = new StringWriter();
        try (JsonGenerator gen = factory.createGenerator(sw)) {
            writeValue(gen, doc);
        } catch (IOException ioe) {
            /* a StringWriter does not fail */
            throw new IllegalStateException(
                "Unable to serialize document: " + ioe.getMessage(), ioe);
        }
        return sw.toString();
    }

    private static void writeValue(JsonGenerator gen, Object value)
        throws IOException {

        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Document) {
            gen.writeStartObject();
            for (Map.Entry<String, Object> entry : (Document) value) {
                gen.writeFieldName(entry.getKey());
                writeValue(gen, entry.getValue());
            }
            gen.writeEndObject();
        } else if (value instanceof List) {
            gen.writeStartArray();
            for (Object o : (List<?>) value) {
                writeValue(gen, o);
            }
            gen.writeEndArray();
        } else if (value instanceof String) {
            gen.writeString((String) value);
        } else if (value instanceof Boolean) {
            gen.writeBoolean((Boolean) value);
        } else if (value instanceof Integer) {
            gen.writeNumber((Integer) value);
        } else if (value instanceof Long) {
            gen.writeNumber((Long) value);
        } else if (value instanceof Double) {
            gen.writeNumber((Double) value);
        } else if (value instanceof BigDecimal) {
            gen.writeNumber((BigDecimal) value);
        } else if (value instanceof BigInteger) {
            gen.writeNumber((BigInteger) value);
        } else if (value instanceof Number) {
            gen.writeNumber(((Number) value).doubleValue());
        } else {
            gen.writeString(value.toString());
        }
    }

    private static JsonParseException createParseException(String msg,
                                                           JsonParser jp) {
        return new JsonParseException(msg,
            (jp != null ? jp.currentLocation() : null));
    }
}
