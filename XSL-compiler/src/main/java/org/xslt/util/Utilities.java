/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.xslt.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jetbrains.annotations.Contract;
import org.xslt.xslCompiler.compiler.errors.CompilationError;
import org.xslt.xslCompiler.compiler.errors.InternalCompilerError;

import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

public class Utilities {
    private Utilities() {}

    /** Like assert, but always enabled.
     * @throws InternalCompilerError if the expression is false. */
    @Contract("false -> fail")
    public static void enforce(boolean expression) {
        enforce(expression, "Assertion failed");
    }

    @Contract("false, _ -> fail")
    public static void enforce(boolean expression, String message) {
        if (!expression)
            throw new InternalCompilerError(message);
    }

    /** No escaping is performed. */
    public static String singleQuote(@Nullable String other) {
        return "'" + other + "'";
    }

    /** The value of a key which must be in the map. */
    public static <K, V> V getExists(Map<K, V> map, K key) {
        V result = map.get(key);
        if (result == null)
            throw new InternalCompilerError("Key " + key + " does not exist in map");
        return result;
    }

    public static <T> T last(List<T> data) {
        enforce(!data.isEmpty(), "Last element of an empty list");
        return data.get(data.size() - 1);
    }

    public static <T> T removeLast(List<T> data) {
        enforce(!data.isEmpty(), "Removing from an empty list");
        return data.remove(data.size() - 1);
    }

    /** Mapper with a stable output order, which rejects duplicate keys when reading. */
    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper.builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY, true)
                .build();
    }

    /** A JSON node printed to the specified depth; deeper containers are shown as "...". */
    public static String toDepth(JsonNode node, int depth) {
        if (!node.isContainerNode())
            return node.toString();
        if (depth == 0)
            return "...";
        StringBuilder builder = new StringBuilder();
        builder.append(node.isArray() ? "[" : "{");
        if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                if (i > 0)
                    builder.append(", ");
                builder.append(toDepth(node.get(i), depth - 1));
            }
        } else {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.append(field.getKey())
                        .append(": ")
                        .append(toDepth(field.getValue(), depth - 1));
                if (fields.hasNext())
                    builder.append(", ");
            }
        }
        builder.append(node.isArray() ? "]" : "}");
        return builder.toString();
    }

    /** @throws CompilationError if the property is missing. */
    public static JsonNode getProperty(JsonNode node, String property) {
        JsonNode prop = node.get(property);
        if (prop == null)
            throw new CompilationError("JSON node does not have property " +
                    singleQuote(property) + ": " + toDepth(node, 1));
        return prop;
    }

    public static String getStringProperty(JsonNode node, String property) {
        return getProperty(node, property).asText();
    }

    /** @throws CompilationError if the property is missing or not an integer. */
    public static long getLongProperty(JsonNode node, String property) {
        JsonNode prop = getProperty(node, property);
        if (!prop.canConvertToLong())
            throw new CompilationError("Property " + singleQuote(property) + " is not an integer: " + toDepth(node, 1));
        return prop.asLong();
    }
}
