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
package com.rabbitmq.worker;

/**
 * Codec to turn application values into message bodies and back.
 *
 * <p>Implementations must be deterministic and free of side effects, decoding an encoded value
 * must return an equal value.
 *
 * @param <T> type of the application values
 * @see com.rabbitmq.worker.codec.AmqpValuePayloadCodec
 * @see com.rabbitmq.worker.codec.JsonPayloadCodec
 */
public interface PayloadCodec<T> {

  byte[] encode(T value);

  /**
   * Decode a message body.
   *
   * @param body the raw message body
   * @return the decoded value
   * @throws DeserializationException if the body is malformed or incompatible with the target type
   */
  T decode(byte[] body);
}
