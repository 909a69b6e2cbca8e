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

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Base45 codec as defined in RFC 9285, the QR alphanumeric-mode text encoding of HCERT.
 */
public final class Base45 {
    private static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ $%*+-./:";
    private static final int BASE = 45;
    private static final int BASE_SQUARED = BASE * BASE;
    private static final int[] DECODE_TABLE = new int[128];

    static {
        Arrays.fill(DECODE_TABLE, -1);
        for (int i = 0; i < ALPHABET.length(); i++) {
            DECODE_TABLE[ALPHABET.charAt(i)] = i;
        }
    }

    private Base45() {
    }

    public static String encode(byte[] data) {
        StringBuilder sb = new StringBuilder((data.length / 2) * 3 + 2);
        int i = 0;
        for (; i + 1 < data.length; i += 2) {
            int n = ((data[i] & 0xFF) << 8) | (data[i + 1] & 0xFF);
            sb.append(ALPHABET.charAt(n % BASE));
            sb.append(ALPHABET.charAt((n / BASE) % BASE));
            sb.append(ALPHABET.charAt(n / BASE_SQUARED));
        }
        if (i < data.length) {
            int n = data[i] & 0xFF;
            sb.append(ALPHABET.charAt(n % BASE));
            sb.append(ALPHABET.charAt(n / BASE));
        }
        return sb.toString();
    }

    /**
     * @throws IllegalArgumentException on characters outside the alphabet, a dangling single character
     *                                  or a chunk whose value exceeds its byte width
     */
    public static byte[] decode(String text) {
        int length = text.length();
        if (length % 3 == 1) {
            throw new IllegalArgumentException("Invalid Base45 length " + length);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream((length / 3) * 2 + 1);
        int i = 0;
        for (; i + 2 < length; i += 3) {
            int n = digit(text, i) + digit(text, i + 1) * BASE + digit(text, i + 2) * BASE_SQUARED;
            if (n > 0xFFFF) {
                throw new IllegalArgumentException("Base45 chunk at offset " + i + " exceeds two bytes");
            }
            out.write(n >> 8);
            out.write(n & 0xFF);
        }
        if (i < length) {
            int n = digit(text, i) + digit(text, i + 1) * BASE;
            if (n > 0xFF) {
                throw new IllegalArgumentException("Base45 chunk at offset " + i + " exceeds one byte");
            }
            out.write(n);
        }
        return out.toByteArray();
    }

    private static int digit(String text, int index) {
        char c = text.charAt(index);
        int value = c < DECODE_TABLE.length ? DECODE_TABLE[c] : -1;
        if (value < 0) {
            throw new IllegalArgumentException("Invalid Base45 character '" + c + "' at offset " + index);
        }
        return value;
    }
}
