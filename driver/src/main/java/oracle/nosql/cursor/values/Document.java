/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.values;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import oracle.nosql.cursor.util.CheckNull;

/**
 * Document is the unit of iteration of a cursor: an ordered mapping of field
 * names to values. Field order is the order in which fields were added, which
 * for documents received from a server is the order the server sent them in.
 * Field names are case-sensitive.
 * <p>
 * Values are plain Java objects: {@link String}, {@link Boolean},
 * {@link Integer}, {@link Long}, {@link Double}, {@link BigDecimal}, nested
 * {@code Document} instances, {@link List} of values, or null for a JSON
 * null.
 * <p>
 * Documents are mutable and not thread-safe.
 */
public class Document implements Iterable<Map.Entry<String, Object>> {

    private final Map<String, Object> values;

    /**
     * Creates an empty Document instance
     */
    public Document() {
        values = new LinkedHashMap<String, Object>();
    }

    /**
     * Creates a Document containing a copy of the given map, in the map's
     * iteration order.
     *
     * @param map the fields to copy
     */
    public Document(Map<String, ?> map) {
        CheckNull.requireNonNullIAE(map, "Document: map must be non-null");
        values = new LinkedHashMap<String, Object>(map);
    }

    /**
     * Creates a Document from a JSON object string.
     *
     * @param json the JSON input
     * @return the document
     *
     * @throws oracle.nosql.cursor.JsonParseException if the input is not a
     * JSON object
     */
    public static Document fromJson(String json) {
        return JsonUtils.parseDocument(json);
    }

    /**
     * Returns a live {@link Map} of the Document state.
     *
     * @return the map
     */
    public Map<String, Object> getMap() {
        return values;
    }

    /**
     * Returns a {@link Set} of entries based on the underlying map
     * that holds the values.
     *
     * @return the set
     */
    public Set<Map.Entry<String, Object>> entrySet() {
        return values.entrySet();
    }

    @Override
    public Iterator<Map.Entry<String, Object>> iterator() {
        return entrySet().iterator();
    }

    /**
     * Returns the number of fields in the document.
     *
     * @return the number of fields
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns whether the named field is present. A field explicitly set
     * to null is present.
     *
     * @param name the field name
     * @return true if the field exists
     */
    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * Sets the named field, replacing any existing value but keeping its
     * position.
     *
     * @param name the field name
     * @param value the value, may be null
     * @return this
     */
    public Document put(String name, Object value) {
        CheckNull.requireNonNullIAE(name,
            "Document.put: name must be non-null");
        values.put(name, value);
        return this;
    }

    /**
     * Returns the value of the named field, or null if it does not exist.
     *
     * @param name the field name
     * @return the value or null
     */
    public Object get(String name) {
        return values.get(name);
    }

    /**
     * Removes the named field.
     *
     * @param name the field name
     * @return the removed value, or null
     */
    public Object remove(String name) {
        return values.remove(name);
    }

    /**
     * Gets the named field as an int.
     *
     * @param name the name of the field
     *
     * @return the int value
     *
     * @throws IllegalArgumentException if the field does not exist.
     *
     * @throws ClassCastException if the field is not numeric
     */
    public int getInt(String name) {
        return ((Number) getExisting(name)).intValue();
    }

    /**
     * Gets the named field as a long.
     *
     * @param name the name of the field
     *
     * @return the long value
     *
     * @throws IllegalArgumentException if the field does not exist.
     *
     * @throws ClassCastException if the field is not numeric
     */
    public long getLong(String name) {
        return ((Number) getExisting(name)).longValue();
    }

    /**
     * Gets the named field as a double.
     *
     * @param name the name of the field
     *
     * @return the double value
     *
     * @throws IllegalArgumentException if the field does not exist.
     *
     * @throws ClassCastException if the field is not numeric
     */
    public double getDouble(String name) {
        return ((Number) getExisting(name)).doubleValue();
    }

    /**
     * Gets the named field as a String.
     *
     * @param name the name of the field
     *
     * @return the string value
     *
     * @throws IllegalArgumentException if the field does not exist.
     *
     * @throws ClassCastException if the field is not a string
     */
    public String getString(String name) {
        return (String) getExisting(name);
    }

    /**
     * Gets the named field as a boolean.
     *
     * @param name the name of the field
     *
     * @return the boolean value
     *
     * @throws IllegalArgumentException if the field does not exist.
     *
     * @throws ClassCastException if the field is not a boolean
     */
    public boolean getBoolean(String name) {
        return (Boolean) getExisting(name);
    }

    /**
     * Gets the named field as a nested document.
     *
     * @param name the name of the field
     *
     * @return the document
     *
     * @throws IllegalArgumentException if the field does not exist.
     *
     * @throws ClassCastException if the field is not a document
     */
    public Document getDocument(String name) {
        return (Document) getExisting(name);
    }

    private Object getExisting(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Field does not exist: " + name);
        }
        return values.get(name);
    }

    /**
     * Returns a copy of this document. Nested documents and lists are
     * copied as well.
     *
     * @return the copy
     */
    public Document copy() {
        Document doc = new Document();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            doc.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return doc;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Document) {
            return ((Document) value).copy();
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<Object>(list.size());
            for (Object o : list) {
                copy.add(copyValue(o));
            }
            return copy;
        }
        return value;
    }

    /**
     * Returns the document as a compact JSON object string.
     *
     * @return the JSON string
     */
    public String toJson() {
        return JsonUtils.toJson(this);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof Document) {
            return values.equals(((Document)other).values);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }
}
