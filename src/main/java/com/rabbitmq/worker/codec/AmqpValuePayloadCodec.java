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

import com.rabbitmq.worker.DeserializationException;
import com.rabbitmq.worker.PayloadCodec;
import java.nio.BufferOverflowException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.qpid.proton.amqp.Binary;
import org.apache.qpid.proton.amqp.messaging.AmqpValue;
import org.apache.qpid.proton.amqp.messaging.Section;
import org.apache.qpid.proton.message.Message;

/**
 * {@link PayloadCodec} that wraps values in an AMQP 1.0 message, in an <code>amqp-value</code>
 * body section.
 *
 * <p>Supported values are the ones of the AMQP type system: maps, lists, strings, numbers,
 * booleans, UUIDs, and byte arrays, nested or not. Byte arrays are decoded as byte arrays.
 *
 * <p>This is the codec to use when nothing else is agreed with producers, the envelope is
 * self-describing.
 */
public class AmqpValuePayloadCodec implements PayloadCodec<Object> {

  private static final int INITIAL_BUFFER_SIZE = 1024;

  @Override
  public byte[] encode(Object value) {
    Message message = Message.Factory.create();
    message.setBody(new AmqpValue(toAmqp(value)));
    int bufferSize = INITIAL_BUFFER_SIZE;
    while (true) {
      byte[] buffer = new byte[bufferSize];
      try {
        int length = message.encode(buffer, 0, buffer.length);
        return Arrays.copyOf(buffer, length);
      } catch (BufferOverflowException e) {
        bufferSize = bufferSize * 2;
      }
    }
  }

  @Override
  public Object decode(byte[] body) {
    if (body == null || body.length == 0) {
      throw new DeserializationException("Cannot decode an empty body");
    }
    Message message = Message.Factory.create();
    try {
      message.decode(body, 0, body.length);
    } catch (RuntimeException e) {
      throw new DeserializationException("Error while decoding AMQP message: " + e.getMessage(), e);
    }
    Section section = message.getBody();
    if (section instanceof AmqpValue) {
      return fromAmqp(((AmqpValue) section).getValue());
    } else {
      throw new DeserializationException(
          "Expected amqp-value body section, got "
              + (section == null ? "no body" : section.getClass().getSimpleName()));
    }
  }

  private static Object toAmqp(Object value) {
    if (value instanceof byte[]) {
      return new Binary((byte[]) value);
    } else if (value instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) value;
      Map<Object, Object> result = new LinkedHashMap<>(map.size());
      map.forEach((k, v) -> result.put(toAmqp(k), toAmqp(v)));
      return result;
    } else if (value instanceof List) {
      List<?> list = (List<?>) value;
      List<Object> result = new ArrayList<>(list.size());
      list.forEach(v -> result.add(toAmqp(v)));
      return result;
    } else {
      return value;
    }
  }

  private static Object fromAmqp(Object value) {
    if (value instanceof Binary) {
      Binary binary = (Binary) value;
      return Arrays.copyOfRange(
          binary.getArray(), binary.getArrayOffset(), binary.getArrayOffset() + binary.getLength());
    } else if (value instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) value;
      Map<Object, Object> result = new LinkedHashMap<>(map.size());
      map.forEach((k, v) -> result.put(fromAmqp(k), fromAmqp(v)));
      return result;
    } else if (value instanceof List) {
      List<?> list = (List<?>) value;
      List<Object> result = new ArrayList<>(list.size());
      list.forEach(v -> result.add(fromAmqp(v)));
      return result;
    } else {
      return value;
    }
  }
}
