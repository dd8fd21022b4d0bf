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

import java.util.List;

/**
 * The {@link Environment} is the main entry point to consume messages from queues. It exposes the
 * pull-mode operations and creates push-mode {@link Subscriber} instances.
 *
 * <p>The environment borrows an AMQP connection: it opens its own channels on it but never closes
 * it.
 *
 * <p>Use {@link Environment#builder()} to configure and create an {@link Environment} instance.
 *
 * <p>{@link Environment} instances are expected to be thread-safe.
 *
 * @see EnvironmentBuilder
 */
public interface Environment extends AutoCloseable {

  /**
   * Create a builder to configure and create an {@link Environment}
   *
   * @return the environment builder
   * @see EnvironmentBuilder
   */
  static EnvironmentBuilder builder() {
    try {
      return (EnvironmentBuilder)
          Class.forName("com.rabbitmq.worker.impl.WorkerEnvironmentBuilder")
              .getConstructor()
              .newInstance();
    } catch (Exception e) {
      throw new WorkerException("Error while creating worker environment builder", e);
    }
  }

  /**
   * Decode a delivery and optionally acknowledge it.
   *
   * <p>A delivery that cannot be decoded is rejected without requeuing and <code>null</code> is
   * returned, whatever the value of <code>ack</code>. If <code>ack</code> is true and the
   * acknowledgment fails, the {@link AckFailurePolicy} decides between retrying and rejecting the
   * message without requeuing (<code>null</code> is returned in the latter case).
   *
   * @param delivery the delivery, with its channel
   * @param codec the codec to decode the body
   * @param ack whether to acknowledge the delivery once decoded
   * @param <T> type of the decoded message
   * @return the decoded message, or null if it could not be decoded or acknowledged
   * @throws ResolutionException if a rejection fails
   */
  <T> T consumeMessage(Delivery delivery, PayloadCodec<T> codec, boolean ack);

  /**
   * Fetch and decode messages from a queue.
   *
   * <p>Exactly <code>count</code> non-blocking fetches are performed on a dedicated channel, the
   * returned list always has <code>count</code> elements, in fetch order. An element is <code>
   * null</code> if the queue was empty at that point or the message could not be decoded.
   *
   * <p>Messages are removed from the queue only if <code>ack</code> is true. Otherwise they go back
   * to the queue when the channel is closed at the end of the operation.
   *
   * @param queue the queue to fetch from
   * @param codec the codec to decode bodies
   * @param ack whether to acknowledge fetched messages
   * @param count the number of fetches
   * @param <T> type of the decoded messages
   * @return the decoded messages, with nulls for empty fetches and undecodable messages
   */
  <T> List<T> fetchMessages(String queue, PayloadCodec<T> codec, boolean ack, int count);

  /**
   * Fetch, process, and resolve messages one by one.
   *
   * <p>For each of the <code>count</code> iterations, a message is fetched, decoded, and handed
   * to the handler. The message is acknowledged if the handler returns normally and rejected with
   * requeuing if it throws. A failing message does not stop the loop.
   *
   * @param queue the queue to fetch from
   * @param codec the codec to decode bodies
   * @param count the number of iterations
   * @param handler the processing logic
   * @param <T> type of the decoded messages
   * @return the outcome of the loop
   */
  <T> ProcessingSummary processMessages(
      String queue, PayloadCodec<T> codec, int count, MessageHandler<T> handler);

  /**
   * Create a {@link SubscriberBuilder} to configure and start a {@link Subscriber}.
   *
   * @param codec the codec to decode bodies
   * @param <T> type of the decoded messages
   * @return the subscriber builder
   */
  <T> SubscriberBuilder<T> subscriberBuilder(PayloadCodec<T> codec);

  /**
   * Start a {@link Subscriber} with default settings.
   *
   * @param workers the number of concurrent workers
   * @param handler the processing logic
   * @param queue the queue to consume from
   * @param codec the codec to decode bodies
   * @param <T> type of the decoded messages
   * @return the started subscriber
   */
  default <T> Subscriber startSubscriber(
      int workers, MessageHandler<T> handler, String queue, PayloadCodec<T> codec) {
    return this.subscriberBuilder(codec)
        .workers(workers)
        .messageHandler(handler)
        .queue(queue)
        .build();
  }

  /** Close the environment and the subscribers it started. The connection stays open. */
  @Override
  void close();
}
