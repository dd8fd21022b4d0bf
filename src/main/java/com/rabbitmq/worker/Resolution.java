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

/** Terminal disposition of a {@link Delivery}. */
public enum Resolution {
  /** The message has been processed, the broker removes it from the queue. */
  ACK,
  /** The message could not be processed, the broker puts it back in the queue. */
  REJECT_REQUEUE,
  /** The message is discarded, the broker drops or dead-letters it. */
  REJECT_DROP
}
