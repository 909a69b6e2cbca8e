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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * ZLIB handling of the HCERT transport layer.
 * <p>
 * Compression is optional on the wire. Data is only inflated when it starts with a valid ZLIB header
 * (RFC 1950); otherwise it is returned unchanged. A COSE_Sign1 item never starts with such a header
 * (major type 6 sets the high bits of the first byte), so the sniff cannot misread uncompressed CBOR.
 */
final class HcertCompression {
    private static final Logger LOG = LoggerFactory.getLogger(HcertCompression.class);
    private static final int DEFLATE_METHOD = 8;
    private static final int MAX_WINDOW_INFO = 7;

    private HcertCompression() {
    }

    static boolean hasZlibHeader(byte[] data) {
        if (data == null || data.length < 2) {
            return false;
        }
        int cmf = data[0] & 0xFF;
        int flg = data[1] & 0xFF;
        return (cmf & 0x0F) == DEFLATE_METHOD
                && (cmf >> 4) <= MAX_WINDOW_INFO
                && ((cmf << 8) | flg) % 31 == 0;
    }

    /**
     * Inflates ZLIB data, or returns the input unchanged when it carries no ZLIB header.
     *
     * @throws DataFormatException if the stream is corrupt, truncated, needs a preset dictionary,
     *                             or inflates beyond {@code maxInflatedLength} bytes
     */
    static byte[] inflateIfCompressed(byte[] data, int maxInflatedLength) throws DataFormatException {
        if (!hasZlibHeader(data)) {
            LOG.debug("[HCERT] No ZLIB header, treating {} bytes as uncompressed", data.length);
            return data;
        }
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(data);
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 2);
            byte[] buffer = new byte[4096];
            while (!inflater.finished()) {
                int len = inflater.inflate(buffer);
                if (len == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DataFormatException("Truncated ZLIB stream after " + out.size() + " bytes");
                }
                if (out.size() + len > maxInflatedLength) {
                    throw new DataFormatException("Inflated data exceeds " + maxInflatedLength + " bytes");
                }
                out.write(buffer, 0, len);
            }
            LOG.debug("[HCERT] Inflated {} bytes to {} bytes", data.length, out.size());
            return out.toByteArray();
        } finally {
            inflater.end();
        }
    }
}
