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
import com.rabbitmq.worker.Delivery;
import com.rabbitmq.worker.Environment;
import com.rabbitmq.worker.MessageHandler;
import com.rabbitmq.worker.PayloadCodec;
import com.rabbitmq.worker.ProcessingSummary;
import com.rabbitmq.worker.Subscriber;
import com.rabbitmq.worker.SubscriberBuilder;
import com.rabbitmq.worker.WorkerException;
import com.rabbitmq.worker.metrics.MetricsCollector;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class WorkerEnvironment implements Environment {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerEnvironment.class);

  private final Connection connection;
  private final MetricsCollector metricsCollector;
  private final MessageConsumer messageConsumer;
  private final BatchFetcher batchFetcher;
  private final ProcessingLoop processingLoop;
  private final ThreadFactory subscriberThreadFactory;
  private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  WorkerEnvironment(
      Connection connection,
      AckFailurePolicy ackFailurePolicy,
      MetricsCollector metricsCollector,
      String threadPrefix) {
    this.connection = connection;
    this.metricsCollector = metricsCollector;
    this.messageConsumer = new MessageConsumer(ackFailurePolicy, metricsCollector);
    this.batchFetcher = new BatchFetcher(connection, this.messageConsumer, metricsCollector);
    this.processingLoop = new ProcessingLoop(connection, this.messageConsumer, metricsCollector);
    this.subscriberThreadFactory = ThreadUtils.threadFactory(threadPrefix + "subscriber-");
    LOGGER.debug(
        "Worker environment created, ack failure policy: {}, metrics collector: {}",
        ackFailurePolicy,
        metricsCollector.getClass().getSimpleName());
  }

  @Override
  public <T> T consumeMessage(Delivery delivery, PayloadCodec<T> codec, boolean ack) {
    checkNotClosed();
    Utils.checkNotNull(delivery, "delivery");
    Utils.checkNotNull(codec, "codec");
    return this.messageConsumer.consume(delivery, codec, ack);
  }

  @Override
  public <T> List<T> fetchMessages(String queue, PayloadCodec<T> codec, boolean ack, int count) {
    checkNotClosed();
    return this.batchFetcher.fetch(queue, codec, ack, count);
  }

  @Override
  public <T> ProcessingSummary processMessages(
      String queue, PayloadCodec<T> codec, int count, MessageHandler<T> handler) {
    checkNotClosed();
    return this.processingLoop.process(queue, codec, count, handler);
  }

  @Override
  public <T> SubscriberBuilder<T> subscriberBuilder(PayloadCodec<T> codec) {
    checkNotClosed();
    return new WorkerSubscriberBuilder<>(this, codec);
  }

  <T> Subscriber startSubscriber(
      String queue,
      PayloadCodec<T> codec,
      MessageHandler<T> messageHandler,
      int workers,
      int prefetchCount,
      String consumerTagPrefix,
      Duration shutdownTimeout) {
    checkNotClosed();
    WorkerSubscriber<T> subscriber =
        new WorkerSubscriber<>(
            this.connection,
            queue,
            codec,
            messageHandler,
            workers,
            prefetchCount,
            consumerTagPrefix,
            shutdownTimeout,
            this.messageConsumer,
            this.metricsCollector,
            this.subscriberThreadFactory,
            this.subscribers::remove);
    this.subscribers.add(subscriber);
    return subscriber;
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      for (Subscriber subscriber : this.subscribers) {
        try {
          subscriber.close();
        } catch (Exception e) {
          LOGGER.warn("Error while closing subscriber: {}", e.getMessage());
        }
      }
      this.subscribers.clear();
      LOGGER.debug("Worker environment closed");
    }
  }

  int subscriberCount() {
    return this.subscribers.size();
  }

  private void checkNotClosed() {
    if (this.closed.get()) {
      throw new WorkerException("This environment instance has been closed");
    }
  }
}
