/*
 * Copyright 2026 Bundesagentur für Arbeit
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.arbeitsagentur.eudcc.common.hcert;

import com.upokecenter.cbor.CBORObject;
import com.upokecenter.cbor.CBORType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utilities for converting CBOR items to plain Java trees that Jackson can serialize.
 * <p>
 * Maps become {@link LinkedHashMap}s with string keys (integer keys such as the CWT claim
 * {@code -260} are rendered in decimal), arrays become lists, byte strings stay {@code byte[]}.
 * Semantic tags are dropped; the tagged content is converted as is.
 */
public final class CborConversionUtils {

    private CborConversionUtils() {
    }

    /**
     * Converts a CBOR item to its Java equivalent.
     *
     * @throws IllegalArgumentException if the item contains a value without a JSON-compatible
     *                                  representation (undefined, non-scalar map keys, colliding keys)
     * @throws ArithmeticException      if an integer does not fit into a {@code long}
     */
    public static Object toJava(CBORObject obj) {
        if (obj == null || obj.isNull()) {
            return null;
        }
        return switch (obj.getType()) {
            case Map -> convertMap(obj);
            case Array -> convertArray(obj);
            case ByteString -> obj.GetByteString();
            case TextString -> obj.AsString();
            case Integer -> obj.AsInt64Value();
            case Boolean -> obj.AsBoolean();
            case FloatingPoint -> obj.AsDoubleValue();
            default -> throw new IllegalArgumentException("Unsupported CBOR item of type " + obj.getType());
        };
    }

    /**
     * Converts a CBOR map to a Java map with string keys.
     *
     * @throws IllegalArgumentException if {@code obj} is not a map or cannot be converted
     */
    public static Map<String, Object> toJavaMap(CBORObject obj) {
        if (obj == null || obj.getType() != CBORType.Map) {
            throw new IllegalArgumentException("CBOR item is not a map");
        }
        return convertMap(obj);
    }

    /**
     * Converts a CBOR map key to a String. Only text and integer keys are supported.
     */
    public static String mapKey(CBORObject key) {
        return switch (key.getType()) {
            case TextString -> key.AsString();
            case Integer -> String.valueOf(key.AsInt64Value());
            default -> throw new IllegalArgumentException("Unsupported CBOR map key of type " + key.getType());
        };
    }

    private static Map<String, Object> convertMap(CBORObject obj) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (CBORObject key : obj.getKeys()) {
            String name = mapKey(key);
            if (map.containsKey(name)) {
                throw new IllegalArgumentException("CBOR map contains colliding keys for '" + name + "'");
            }
            map.put(name, toJava(obj.get(key)));
        }
        return map;
    }

    private static List<Object> convertArray(CBORObject obj) {
        List<Object> list = new ArrayList<>(obj.size());
        for (int i = 0; i < obj.size(); i++) {
            list.add(toJava(obj.get(i)));
        }
        return list;
    }
}
