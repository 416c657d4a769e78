package org.xslt.util;

import org.junit.Assert;
import org.junit.Test;

public class IndentStreamTests {
    @Test
    public void testIndent() {
        IndentStream stream = new IndentStream(new StringBuilder());
        stream.append("a").increase()
                .append("b").newline()
                .append("c").decrease().newline()
                .append("d");
        Assert.assertEquals("a\n    b\n    c\nd", stream.toString());
    }

    @Test
    public void testJson() {
        JsonStream json = new JsonStream(new IndentStream(new StringBuilder()));
        json.beginObject()
                .label("kind").append("NOT")
                .label("children").beginArray().appendNull().append(3L).endArray()
                .endObject();
        String expected = "{\n" +
                "    \"kind\": \"NOT\",\n" +
                "    \"children\": [\n" +
                "        null,\n" +
                "        3\n" +
                "    ]\n" +
                "}";
        Assert.assertEquals(expected, json.toString());
    }

    @Test
    public void testJsonEscapes() {
        JsonStream json = new JsonStream(new IndentStream(new StringBuilder()));
        json.append("a\"b\n");
        Assert.assertEquals("\"a\\\"b\\n\"", json.toString());
    }

    @Test(expected = RuntimeException.class)
    public void testLabelOutsideObject() {
        JsonStream json = new JsonStream(new IndentStream(new StringBuilder()));
        json.beginArray().label("x");
    }
}
