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
package com.rabbitmq.worker.metrics;

/**
 * Interface to collect consumption metrics.
 *
 * <p>Implementations are called from the caller thread in pull mode and from the worker threads in
 * push mode, so they must be thread-safe.
 *
 * @see NoOpMetricsCollector
 * @see MicrometerMetricsCollector
 */
public interface MetricsCollector {

  /** A message has been received from the broker. */
  void fetched();

  /** A pull-mode fetch found the queue empty. */
  void emptyFetch();

  /** A message has been acknowledged. */
  void acked();

  /**
   * A message has been rejected.
   *
   * @param requeue whether the message was requeued
   */
  void rejected(boolean requeue);

  /** A message body could not be decoded. */
  void deserializationFailed();

  /** The application handler failed to process a message. */
  void processingFailed();
}
