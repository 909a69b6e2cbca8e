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

import COSE.AlgorithmID;
import COSE.Attribute;
import COSE.OneKey;
import COSE.Sign1Message;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import com.upokecenter.cbor.CBORObject;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.zip.Deflater;

/**
 * Builds signed HCERT strings the way an issuer does, for decoder tests.
 */
final class HcertTestData {
    static final String ISSUER = "AT";
    static final String SCHEMA_VERSION = "1.2.1";
    static final String KEY_ID = "d3ff2f13";

    private HcertTestData() {
    }

    static ECKey signingKey() throws Exception {
        return new ECKeyGenerator(Curve.P_256)
                .keyUse(KeyUse.SIGNATURE)
                .keyID(KEY_ID)
                .generate();
    }

    static Instant issuedAt() {
        return Instant.now().minus(Duration.ofDays(1)).truncatedTo(ChronoUnit.SECONDS);
    }

    static Instant expiresAt() {
        return Instant.now().plus(Duration.ofDays(365)).truncatedTo(ChronoUnit.SECONDS);
    }

    static CBORObject name() {
        CBORObject nam = CBORObject.NewMap();
        nam.Add("fn", "Musterfrau-Gößinger");
        nam.Add("fnt", "MUSTERFRAU<GOESSINGER");
        nam.Add("gn", "Gabriele");
        nam.Add("gnt", "GABRIELE");
        return nam;
    }

    static CBORObject vaccination() {
        CBORObject v = CBORObject.NewMap();
        v.Add("tg", "840539006");
        v.Add("vp", "1119349007");
        v.Add("mp", "EU/1/20/1528");
        v.Add("ma", "ORG-100030215");
        v.Add("dn", 2);
        v.Add("sd", 2);
        v.Add("dt", "2021-02-18");
        v.Add("co", "AT");
        v.Add("is", "Ministry of Health, Austria");
        v.Add("ci", "URN:UVCI:01:AT:10807843F94AEE0EE5093FBC254BD813#B");
        return v;
    }

    static CBORObject dcc(String entryKey, CBORObject entry) {
        CBORObject dcc = CBORObject.NewMap();
        dcc.Add("ver", SCHEMA_VERSION);
        dcc.Add("nam", name());
        dcc.Add("dob", "1998-02-26");
        CBORObject entries = CBORObject.NewArray();
        entries.Add(entry);
        dcc.Add(entryKey, entries);
        return dcc;
    }

    static CBORObject claims(CBORObject dcc) {
        return claims(ISSUER, issuedAt(), expiresAt(), dcc);
    }

    static CBORObject claims(String issuer, Instant issuedAt, Instant expiresAt, CBORObject dcc) {
        CBORObject hcert = CBORObject.NewMap();
        hcert.Add(CBORObject.FromObject(1), dcc);
        CBORObject claims = CBORObject.NewMap();
        claims.Add(CBORObject.FromObject(1), CBORObject.FromObject(issuer));
        claims.Add(CBORObject.FromObject(4), CBORObject.FromObject(expiresAt.getEpochSecond()));
        claims.Add(CBORObject.FromObject(6), CBORObject.FromObject(issuedAt.getEpochSecond()));
        claims.Add(CBORObject.FromObject(-260), hcert);
        return claims;
    }

    static byte[] sign(byte[] payload, ECKey key) throws Exception {
        Sign1Message sign1 = new Sign1Message();
        sign1.addAttribute(CBORObject.FromObject(1), AlgorithmID.ECDSA_256.AsCBOR(), Attribute.PROTECTED);
        sign1.addAttribute(CBORObject.FromObject(4),
                CBORObject.FromObject(key.getKeyID().getBytes(StandardCharsets.US_ASCII)), Attribute.PROTECTED);
        sign1.SetContent(payload);
        sign1.sign(toCoseKey(key, true));
        return sign1.EncodeToBytes();
    }

    static OneKey toCoseKey(ECKey key, boolean includePrivate) throws Exception {
        CBORObject cborKey = CBORObject.NewMap();
        cborKey.Add(CBORObject.FromObject(1), CBORObject.FromObject(2)); // kty: EC2
        cborKey.Add(CBORObject.FromObject(-1), CBORObject.FromObject(1)); // crv: P-256
        cborKey.Add(CBORObject.FromObject(-2), CBORObject.FromObject(key.getX().decode()));
        cborKey.Add(CBORObject.FromObject(-3), CBORObject.FromObject(key.getY().decode()));
        if (includePrivate) {
            cborKey.Add(CBORObject.FromObject(-4), CBORObject.FromObject(key.getD().decode()));
        }
        return new OneKey(cborKey);
    }

    static byte[] deflate(byte[] data) {
        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
        deflater.setInput(data);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[1024];
        while (!deflater.finished()) {
            int len = deflater.deflate(buffer);
            out.write(buffer, 0, len);
        }
        deflater.end();
        return out.toByteArray();
    }

    static String encode(byte[] coseBytes, boolean compress) {
        byte[] transport = compress ? deflate(coseBytes) : coseBytes;
        return DecoderOptions.DEFAULT_PREFIX + Base45.encode(transport);
    }

    static String signedCertificate(ECKey key, CBORObject claims) throws Exception {
        return encode(sign(claims.EncodeToBytes(), key), true);
    }

    static CBORObject taggedArray(CBORObject... elements) {
        CBORObject array = CBORObject.NewArray();
        for (CBORObject element : elements) {
            array.Add(element);
        }
        return CBORObject.FromObjectAndTag(array, 18);
    }
}
