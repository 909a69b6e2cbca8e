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
import de.arbeitsagentur.eudcc.common.model.HealthCertificateClaims;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.cfg.CoercionAction;
import tools.jackson.databind.cfg.CoercionInputShape;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.type.LogicalType;

import java.time.DateTimeException;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the decoded COSE payload into typed certificate claims.
 * <p>
 * The CBOR map is converted into a plain Java tree, serialized to JSON and bound to the claim schema
 * with Jackson. The resulting claims carry neither envelope nor text; the decoder adds both.
 */
public class HealthCertificateMaterializer {
    private final ObjectMapper objectMapper;

    public HealthCertificateMaterializer() {
        this(defaultObjectMapper());
    }

    public HealthCertificateMaterializer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Mapper that requires all schema fields marked as required, ignores claims it does not know and
     * refuses to convert between text, numbers and booleans.
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .withCoercionConfig(LogicalType.Textual, cfg -> cfg
                        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
                .withCoercionConfig(LogicalType.Integer, cfg -> cfg
                        .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
                .withCoercionConfig(LogicalType.Float, cfg -> cfg
                        .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
                .withCoercionConfig(LogicalType.Boolean, cfg -> cfg
                        .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail))
                .build();
    }

    public HealthCertificateClaims materialize(CBORObject cbor) throws HealthCertificateDecodingException {
        if (cbor == null || cbor.getType() != CBORType.Map) {
            throw HealthCertificateDecodingException.payloadConversion(null);
        }
        byte[] json;
        try {
            Map<String, Object> tree = CborConversionUtils.toJavaMap(cbor);
            json = objectMapper.writeValueAsBytes(tree);
        } catch (IllegalArgumentException | ArithmeticException | JacksonException e) {
            throw HealthCertificateDecodingException.payloadConversion(e);
        }
        try {
            return objectMapper.readValue(json, HcertPayload.class).toClaims();
        } catch (JacksonException | DateTimeException e) {
            throw HealthCertificateDecodingException.schema(e);
        }
    }
}
