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

public final class NoOpMetricsCollector implements MetricsCollector {

  public static final MetricsCollector SINGLETON = new NoOpMetricsCollector();

  private NoOpMetricsCollector() {}

  @Override
  public void fetched() {}

  @Override
  public void emptyFetch() {}

  @Override
  public void acked() {}

  @Override
  public void rejected(boolean requeue) {}

  @Override
  public void deserializationFailed() {}

  @Override
  public void processingFailed() {}
}
