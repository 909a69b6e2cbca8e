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
package de.arbeitsagentur.eudcc.common.util;

import java.util.HexFormat;

/**
 * Small helpers to render byte sequences as hexadecimal text for logs and diagnostics.
 */
public final class HexUtils {
    private static final HexFormat HEX = HexFormat.of();
    private static final int PREVIEW_BYTES = 32;

    private HexUtils() {
    }

    public static String encode(byte[] data) {
        if (data == null || data.length == 0) {
            return "";
        }
        return HEX.formatHex(data);
    }

    /**
     * Hex of the leading bytes only, suffixed with the total length when truncated.
     */
    public static String preview(byte[] data) {
        if (data == null || data.length <= PREVIEW_BYTES) {
            return encode(data);
        }
        return HEX.formatHex(data, 0, PREVIEW_BYTES) + "... (" + data.length + " bytes)";
    }
}
