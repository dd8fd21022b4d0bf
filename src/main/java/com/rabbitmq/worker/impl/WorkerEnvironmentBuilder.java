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
package com.rabbitmq.worker.impl;

import com.rabbitmq.client.Connection;
import com.rabbitmq.worker.AckFailurePolicy;
import com.rabbitmq.worker.Environment;
import com.rabbitmq.worker.EnvironmentBuilder;
import com.rabbitmq.worker.metrics.MetricsCollector;
import com.rabbitmq.worker.metrics.NoOpMetricsCollector;

public class WorkerEnvironmentBuilder implements EnvironmentBuilder {

  private static final String DEFAULT_THREAD_PREFIX = "rabbitmq-worker-";

  private Connection connection;
  private AckFailurePolicy ackFailurePolicy = AckFailurePolicy.rejectDrop();
  private MetricsCollector metricsCollector = NoOpMetricsCollector.SINGLETON;
  private String threadPrefix = DEFAULT_THREAD_PREFIX;

  public WorkerEnvironmentBuilder() {}

  @Override
  public EnvironmentBuilder connection(Connection connection) {
    this.connection = connection;
    return this;
  }

  @Override
  public EnvironmentBuilder ackFailurePolicy(AckFailurePolicy ackFailurePolicy) {
    if (ackFailurePolicy == null) {
      throw new IllegalArgumentException("The ack failure policy cannot be null");
    }
    this.ackFailurePolicy = ackFailurePolicy;
    return this;
  }

  @Override
  public EnvironmentBuilder metricsCollector(MetricsCollector metricsCollector) {
    if (metricsCollector == null) {
      throw new IllegalArgumentException("The metrics collector cannot be null");
    }
    this.metricsCollector = metricsCollector;
    return this;
  }

  @Override
  public EnvironmentBuilder threadPrefix(String threadPrefix) {
    this.threadPrefix = threadPrefix == null ? DEFAULT_THREAD_PREFIX : threadPrefix;
    return this;
  }

  @Override
  public Environment build() {
    if (this.connection == null) {
      throw new IllegalArgumentException("A connection must be set");
    }
    return new WorkerEnvironment(
        this.connection, this.ackFailurePolicy, this.metricsCollector, this.threadPrefix);
  }
}
