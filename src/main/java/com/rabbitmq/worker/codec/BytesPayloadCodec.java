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

import com.rabbitmq.worker.PayloadCodec;

/** Pass-through {@link PayloadCodec}, for tools that inspect or replay raw bodies. */
public class BytesPayloadCodec implements PayloadCodec<byte[]> {

  private static final byte[] EMPTY = new byte[0];

  @Override
  public byte[] encode(byte[] value) {
    return value == null ? EMPTY : value;
  }

  @Override
  public byte[] decode(byte[] body) {
    return body == null ? EMPTY : body;
  }
}
