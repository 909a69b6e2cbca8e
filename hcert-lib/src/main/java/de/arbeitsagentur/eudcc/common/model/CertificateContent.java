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
package de.arbeitsagentur.eudcc.common.model;

/**
 * The single vaccination, test or recovery entry a certificate carries.
 */
public interface CertificateContent {

    ContentType type();

    /** Targeted disease or agent ({@code tg}), e.g. {@code 840539006} for COVID-19 */
    String diseaseAgentTargeted();

    /** Member state or third country of the event ({@code co}) */
    String country();

    /** Certificate issuer ({@code is}) */
    String certificateIssuer();

    /** Unique certificate identifier ({@code ci}) */
    String certificateIdentifier();
}
