/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.values;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import oracle.nosql.cursor.JsonParseException;

import org.junit.Test;

/**
 * Document accessors and JSON conversion.
 */
public class DocumentTest {

    @Test
    public void testAccessors() {
        Document doc = new Document()
            .put("i", 1)
            .put("l", 1L << 40)
            .put("d", 2.5)
            .put("s", "str")
            .put("b", true)
            .put("n", null)
            .put("nested", new Document().put("x", 7));

        assertEquals(1, doc.getInt("i"));
        assertEquals(1L << 40, doc.getLong("l"));
        assertEquals(2.5, doc.getDouble("d"), 0.0);
        assertEquals("str", doc.getString("s"));
        assertTrue(doc.getBoolean("b"));
        assertTrue(doc.contains("n"));
        assertNull(doc.get("n"));
        assertEquals(7, doc.getDocument("nested").getInt("x"));
        assertEquals(7, doc.size());
        assertEquals(7, doc.entrySet().size());
        assertEquals(Integer.valueOf(1), doc.getMap().get("i"));
        assertEquals("str", doc.remove("s"));
        assertFalse(doc.contains("s"));
        doc.put("s", "str");

        try {
            doc.getInt("missing");
            fail("missing field should fail");
        } catch (IllegalArgumentException iae) {
            assertTrue(iae.getMessage().contains("missing"));
        }
        try {
            doc.getInt("s");
            fail("non-numeric field should fail");
        } catch (ClassCastException cce) {
            /* success */
        }
        try {
            doc.put(null, 1);
            fail("null name should fail");
        } catch (IllegalArgumentException iae) {
            /* success */
        }
    }

    @Test
    public void testFieldOrder() {
        Document doc = new Document().put("z", 1).put("a", 2).put("m", 3);
        doc.put("z", 4);

        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Object> e : doc) {
            names.add(e.getKey());
        }
        assertEquals(Arrays.asList("z", "a", "m"), names);
        assertEquals("{\"z\":4,\"a\":2,\"m\":3}", doc.toJson());
    }

    @Test
    public void testFromJson() {
        Document doc = Document.fromJson(
            "{\"_id\": 5, \"big\": 12345678901, \"f\": 1.25, " +
            "\"t\": true, \"n\": null, \"arr\": [1, \"two\", {\"k\": 3}], " +
            "\"obj\": {\"a\": \"b\"}, \"huge\": 123456789012345678901}");

        assertEquals(Integer.valueOf(5), doc.get("_id"));
        assertEquals(Long.valueOf(12345678901L), doc.get("big"));
        assertEquals(1.25, doc.getDouble("f"), 0.0);
        assertTrue(doc.getBoolean("t"));
        assertTrue(doc.contains("n"));
        assertEquals("b", doc.getDocument("obj").getString("a"));
        assertTrue(doc.get("huge") instanceof BigDecimal);

        List<?> arr = (List<?>) doc.get("arr");
        assertEquals(3, arr.size());
        assertEquals("two", arr.get(1));
        assertEquals(3, ((Document) arr.get(2)).getInt("k"));

        /* text form survives a second trip */
        assertEquals(doc, Document.fromJson(doc.toJson()));
    }

    @Test
    public void testBadJson() {
        String[] bad = {
            "[1, 2]",
            "{\"a\": 1",
            "{\"a\": 1} {\"b\": 2}",
            "not json",
            ""
        };
        for (String json : bad) {
            try {
                Document.fromJson(json);
                fail("Should have failed: " + json);
            } catch (JsonParseException jpe) {
                assertNotNull(jpe.getMessage());
            }
        }

        try {
            Document.fromJson("{\n\"a\": tru}");
            fail("Should have failed");
        } catch (JsonParseException jpe) {
            assertNotNull(jpe.getLocation());
            assertTrue(jpe.getMessage(), jpe.getMessage().contains("line 2"));
        }
    }

    @Test
    public void testCopy() {
        Document doc = Document.fromJson(
            "{\"a\": {\"b\": [1, {\"c\": 2}]}}");
        Document copy = doc.copy();
        assertEquals(doc, copy);
        assertEquals(doc.hashCode(), copy.hashCode());

        copy.getDocument("a").put("b", "changed");
        assertNotEquals(doc, copy);
        assertTrue(doc.getDocument("a").get("b") instanceof List);
        assertFalse(doc.getDocument("a").get("b").equals("changed"));
    }

    @Test
    public void testToString() {
        Document doc = new Document().put("s", "quote\"d").put("l", List.of());
        assertEquals("{\"s\":\"quote\\\"d\",\"l\":[]}", doc.toString());
    }
}
