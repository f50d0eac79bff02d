/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.linecorp.resilient.client;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

/**
 * Encodes request payloads and decodes response payloads as UTF-8 JSON.
 */
final class JsonPayloadCodec {

    private final ObjectMapper mapper;

    private final ObjectReader reader;

    JsonPayloadCodec() {
        this(new ObjectMapper());
    }

    JsonPayloadCodec(ObjectMapper mapper) {
        this.mapper = requireNonNull(mapper, "mapper");
        reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    byte[] encode(Object payload) {
        requireNonNull(payload, "payload");
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new PayloadException("failed to serialize a request payload of " +
                                       payload.getClass().getName(), e);
        }
    }

    /**
     * Decodes a single JSON object. A zero-length body yields an empty mutable {@link Map}.
     * Anything else must be exactly one UTF-8 encoded JSON object.
     */
    Map<String, Object> decode(byte[] body) {
        if (body == null || body.length == 0) {
            return new LinkedHashMap<>();
        }

        final JsonNode node;
        try {
            node = reader.readTree(decodeUtf8(body));
        } catch (IOException e) {
            throw new PayloadException("malformed response payload", e);
        }
        if (node == null || node.isMissingNode()) {
            throw new PayloadException("response payload has no JSON value");
        }
        if (!node.isObject()) {
            throw new PayloadException("response payload is not a JSON object: " + node.getNodeType());
        }

        @SuppressWarnings("unchecked")
        final Map<String, Object> map = mapper.convertValue(node, LinkedHashMap.class);
        return map;
    }

    private static String decodeUtf8(byte[] body) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                                         .onMalformedInput(CodingErrorAction.REPORT)
                                         .onUnmappableCharacter(CodingErrorAction.REPORT)
                                         .decode(ByteBuffer.wrap(body))
                                         .toString();
        } catch (CharacterCodingException e) {
            throw new PayloadException("response payload is not valid UTF-8", e);
        }
    }
}
