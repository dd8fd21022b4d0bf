// Copyright (c) 2025 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// This software, the RabbitMQ Queue Worker Java library, is dual-licensed under the
// Mozilla Public License 2.0 ("MPL"), and the Apache License version 2 ("ASL").
// For the MPL, please see LICENSE-MPL-RabbitMQ. For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.worker.codec;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.rabbitmq.worker.DeserializationException;
import com.rabbitmq.worker.PayloadCodec;
import java.lang.reflect.Type;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * {@link PayloadCodec} for UTF-8 JSON bodies, based on Gson.
 *
 * @param <T> the target type
 */
public class JsonPayloadCodec<T> implements PayloadCodec<T> {

  private final Gson gson;
  private final Type type;

  public JsonPayloadCodec(Class<T> type) {
    this(new Gson(), type);
  }

  public JsonPayloadCodec(TypeToken<T> typeToken) {
    this(new Gson(), typeToken.getType());
  }

  public JsonPayloadCodec(Gson gson, Class<T> type) {
    this(gson, (Type) type);
  }

  private JsonPayloadCodec(Gson gson, Type type) {
    if (gson == null || type == null) {
      throw new IllegalArgumentException("Gson instance and target type are required");
    }
    this.gson = gson;
    this.type = type;
  }

  @Override
  public byte[] encode(T value) {
    return gson.toJson(value, type).getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public T decode(byte[] body) {
    if (body == null || body.length == 0) {
      throw new DeserializationException("Cannot decode an empty body");
    }
    String json;
    try {
      json =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(body))
              .toString();
    } catch (CharacterCodingException e) {
      throw new DeserializationException("Body is not valid UTF-8", e);
    }
    T value;
    try {
      value = gson.fromJson(json, type);
    } catch (JsonParseException e) {
      throw new DeserializationException("Error while decoding JSON body: " + e.getMessage(), e);
    }
    if (value == null) {
      throw new DeserializationException("JSON body decoded to null");
    }
    return value;
  }
}
