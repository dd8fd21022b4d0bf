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

import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConsumerShutdownSignalCallback;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.worker.Delivery;
import com.rabbitmq.worker.MessageHandler;
import com.rabbitmq.worker.PayloadCodec;
import com.rabbitmq.worker.ResolutionChannel;
import com.rabbitmq.worker.ResolutionException;
import com.rabbitmq.worker.Subscriber;
import com.rabbitmq.worker.WorkerException;
import com.rabbitmq.worker.metrics.MetricsCollector;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Push-mode subscriber: one thread and one channel per worker.
 *
 * <p>The broker callbacks only hand deliveries over to the worker thread, which decodes,
 * processes, and resolves them one at a time. Resolutions on a channel are then always issued by
 * the same thread, in delivery order.
 */
final class WorkerSubscriber<T> implements Subscriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerSubscriber.class);

  static final long POLL_TIMEOUT_MS = 100;

  private final String queue;
  private final PayloadCodec<T> codec;
  private final MessageHandler<T> messageHandler;
  private final MessageConsumer messageConsumer;
  private final MetricsCollector metricsCollector;
  private final Duration shutdownTimeout;
  private final Consumer<Subscriber> closeCallback;
  private final List<Worker> workers;
  private final ExecutorService executorService;
  private final List<Channel> channels;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  WorkerSubscriber(
      Connection connection,
      String queue,
      PayloadCodec<T> codec,
      MessageHandler<T> messageHandler,
      int workerCount,
      int prefetchCount,
      String consumerTagPrefix,
      Duration shutdownTimeout,
      MessageConsumer messageConsumer,
      MetricsCollector metricsCollector,
      ThreadFactory threadFactory,
      Consumer<Subscriber> closeCallback) {
    this.queue = queue;
    this.codec = codec;
    this.messageHandler = messageHandler;
    this.messageConsumer = messageConsumer;
    this.metricsCollector = metricsCollector;
    this.shutdownTimeout = shutdownTimeout;
    this.closeCallback = closeCallback;
    this.workers = new ArrayList<>(workerCount);
    this.channels = new ArrayList<>(workerCount);
    this.executorService = Executors.newFixedThreadPool(workerCount, threadFactory);
    try {
      for (int i = 0; i < workerCount; i++) {
        Channel channel = Utils.openChannel(connection);
        this.channels.add(channel);
        Worker worker = new Worker(i, channel);
        worker.start(prefetchCount, consumerTagPrefix);
        this.workers.add(worker);
        this.executorService.execute(worker);
      }
    } catch (IOException | RuntimeException e) {
      LOGGER.warn("Error while starting subscriber on queue '{}', shutting it down", queue);
      this.shutdown();
      if (e instanceof WorkerException) {
        throw (WorkerException) e;
      } else {
        throw new WorkerException("Error while starting subscriber on queue '" + queue + "'", e);
      }
    }
    LOGGER.debug("Subscriber started on queue '{}' with {} worker(s)", queue, workerCount);
  }

  @Override
  public boolean isOpen() {
    return !this.closed.get();
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing subscriber on queue '{}'", this.queue);
      this.shutdown();
      this.closeCallback.accept(this);
      LOGGER.debug("Subscriber on queue '{}' closed", this.queue);
    }
  }

  private void shutdown() {
    this.closed.set(true);
    this.workers.forEach(Worker::stop);
    this.executorService.shutdown();
    try {
      if (!this.executorService.awaitTermination(
          this.shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.info(
            "Workers of subscriber on queue '{}' did not stop in {}, closing their channels anyway",
            this.queue,
            this.shutdownTimeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    // last opened, first closed
    for (int i = this.channels.size() - 1; i >= 0; i--) {
      Utils.closeChannel(this.channels.get(i));
    }
  }

  int workerCount() {
    return this.workers.size();
  }

  private final class Worker implements Runnable {

    private final int index;
    private final Channel channel;
    private final ResolutionChannel resolutionChannel;
    private final BlockingQueue<com.rabbitmq.client.Delivery> deliveries =
        new LinkedBlockingQueue<>();
    private volatile boolean running = true;
    private volatile String consumerTag;

    private Worker(int index, Channel channel) {
      this.index = index;
      this.channel = channel;
      this.resolutionChannel = new AmqpResolutionChannel(channel);
    }

    private void start(int prefetchCount, String consumerTagPrefix) throws IOException {
      this.channel.basicQos(prefetchCount);
      DeliverCallback deliverCallback =
          (tag, message) -> {
            if (this.running) {
              this.deliveries.add(message);
            }
          };
      CancelCallback cancelCallback =
          tag -> {
            LOGGER.info(
                "Consumer {} of worker {} on queue '{}' has been cancelled by the broker",
                tag,
                this.index,
                queue);
            this.running = false;
          };
      ConsumerShutdownSignalCallback shutdownCallback =
          (tag, signal) -> {
            if (this.running) {
              LOGGER.info(
                  "Channel of worker {} on queue '{}' has been shut down: {}",
                  this.index,
                  queue,
                  signal.getMessage());
            }
            this.running = false;
          };
      String tag = consumerTagPrefix == null ? "" : consumerTagPrefix + this.index;
      this.consumerTag =
          this.channel.basicConsume(
              queue, false, tag, deliverCallback, cancelCallback, shutdownCallback);
      LOGGER.debug(
          "Worker {} registered on queue '{}' with consumer tag {}",
          this.index,
          queue,
          this.consumerTag);
    }

    @Override
    public void run() {
      try {
        while (this.running) {
          com.rabbitmq.client.Delivery message =
              this.deliveries.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
          if (message != null) {
            handle(message);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (RuntimeException | Error e) {
        LOGGER.error(
            "Unexpected error in worker {} on queue '{}', stopping it and closing its channel",
            this.index,
            queue,
            e);
        this.running = false;
        // unresolved deliveries go back to the queue
        Utils.closeChannel(this.channel);
      }
      if (!this.deliveries.isEmpty()) {
        LOGGER.debug(
            "Worker {} on queue '{}' abandoning {} unprocessed message(s)",
            this.index,
            queue,
            this.deliveries.size());
      }
      LOGGER.debug("Worker {} on queue '{}' stopped", this.index, queue);
    }

    private void handle(com.rabbitmq.client.Delivery message) {
      metricsCollector.fetched();
      Delivery delivery =
          new Delivery(
              message.getEnvelope().getDeliveryTag(),
              message.getBody(),
              this.resolutionChannel,
              message.getEnvelope().isRedeliver(),
              queue);
      try {
        T decoded = messageConsumer.consume(delivery, codec, false);
        if (decoded == null) {
          return;
        }
        try {
          messageHandler.handle(decoded);
        } catch (Exception | Error e) {
          metricsCollector.processingFailed();
          LOGGER.warn(
              "Error while processing message {} from queue '{}', rejecting it without requeuing",
              delivery.deliveryTag(),
              queue,
              e);
          messageConsumer.reject(delivery, false);
          if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          return;
        }
        messageConsumer.acknowledge(delivery);
      } catch (ResolutionException e) {
        LOGGER.warn(
            "Could not resolve message {} from queue '{}': {}",
            delivery.deliveryTag(),
            queue,
            e.getMessage());
        if (!this.resolutionChannel.isOpen()) {
          LOGGER.info("Channel of worker {} on queue '{}' is closed, stopping", this.index, queue);
          this.running = false;
        }
      }
    }

    private void stop() {
      this.running = false;
      if (this.consumerTag != null) {
        try {
          this.channel.basicCancel(this.consumerTag);
        } catch (IOException | ShutdownSignalException e) {
          LOGGER.debug(
              "Error while cancelling consumer {} of worker {}: {}",
              this.consumerTag,
              this.index,
              e.getMessage());
        }
      }
    }
  }
}
