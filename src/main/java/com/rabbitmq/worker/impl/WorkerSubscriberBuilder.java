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

import com.rabbitmq.worker.MessageHandler;
import com.rabbitmq.worker.PayloadCodec;
import com.rabbitmq.worker.Subscriber;
import com.rabbitmq.worker.SubscriberBuilder;
import java.time.Duration;

class WorkerSubscriberBuilder<T> implements SubscriberBuilder<T> {

  private static final int PREFETCH_COUNT_MAX = 65535;

  private final WorkerEnvironment environment;
  private final PayloadCodec<T> codec;
  private String queue;
  private MessageHandler<T> messageHandler;
  private int workers = 1;
  private int prefetchCount = 1;
  private String consumerTagPrefix;
  private Duration shutdownTimeout = Duration.ofSeconds(10);

  WorkerSubscriberBuilder(WorkerEnvironment environment, PayloadCodec<T> codec) {
    this.environment = environment;
    this.codec = codec;
  }

  @Override
  public SubscriberBuilder<T> queue(String queue) {
    this.queue = queue;
    return this;
  }

  @Override
  public SubscriberBuilder<T> messageHandler(MessageHandler<T> messageHandler) {
    this.messageHandler = messageHandler;
    return this;
  }

  @Override
  public SubscriberBuilder<T> workers(int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("The number of workers must be at least 1");
    }
    this.workers = workers;
    return this;
  }

  @Override
  public SubscriberBuilder<T> prefetchCount(int prefetchCount) {
    if (prefetchCount < 0 || prefetchCount > PREFETCH_COUNT_MAX) {
      throw new IllegalArgumentException(
          "The prefetch count must be between 0 and " + PREFETCH_COUNT_MAX);
    }
    this.prefetchCount = prefetchCount;
    return this;
  }

  @Override
  public SubscriberBuilder<T> consumerTagPrefix(String consumerTagPrefix) {
    this.consumerTagPrefix = consumerTagPrefix;
    return this;
  }

  @Override
  public SubscriberBuilder<T> shutdownTimeout(Duration shutdownTimeout) {
    if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
      throw new IllegalArgumentException("The shutdown timeout must be positive or zero");
    }
    this.shutdownTimeout = shutdownTimeout;
    return this;
  }

  @Override
  public Subscriber build() {
    Utils.checkQueue(this.queue);
    Utils.checkNotNull(this.codec, "codec");
    if (this.messageHandler == null) {
      throw new IllegalArgumentException("A message handler must be set");
    }
    return this.environment.startSubscriber(
        this.queue,
        this.codec,
        this.messageHandler,
        this.workers,
        this.prefetchCount,
        this.consumerTagPrefix,
        this.shutdownTimeout);
  }
}
