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

import java.time.Duration;

/**
 * Contract to decide what to do when the acknowledgment of a successfully processed message
 * fails.
 *
 * <p>The policy returns the delay before a new acknowledgment attempt. It returns {@link #GIVE_UP}
 * when the message should be rejected without requeuing instead.
 *
 * @see EnvironmentBuilder#ackFailurePolicy(AckFailurePolicy)
 */
public interface AckFailurePolicy {

  Duration GIVE_UP = Duration.ofMillis(Long.MAX_VALUE);

  /**
   * Reject the message without requeuing as soon as the acknowledgment fails.
   *
   * <p>This is the default.
   *
   * @return the reject-drop policy
   */
  static AckFailurePolicy rejectDrop() {
    return RejectDropAckFailurePolicy.INSTANCE;
  }

  /**
   * Retry the acknowledgment with a constant delay, then reject without requeuing.
   *
   * @param maxAttempts total number of acknowledgment attempts, first one included
   * @param delay the delay between attempts
   * @return the retry policy
   */
  static AckFailurePolicy retry(int maxAttempts, Duration delay) {
    return new RetryAckFailurePolicy(maxAttempts, delay);
  }

  /**
   * Returns the delay before the next acknowledgment attempt.
   *
   * @param failedAttempts the number of failed attempts so far, starts at 1
   * @return the delay, {@link #GIVE_UP} to stop retrying
   */
  Duration delay(int failedAttempts);

  final class RejectDropAckFailurePolicy implements AckFailurePolicy {

    private static final AckFailurePolicy INSTANCE = new RejectDropAckFailurePolicy();

    private RejectDropAckFailurePolicy() {}

    @Override
    public Duration delay(int failedAttempts) {
      return GIVE_UP;
    }

    @Override
    public String toString() {
      return "RejectDropAckFailurePolicy{}";
    }
  }

  final class RetryAckFailurePolicy implements AckFailurePolicy {

    private final int maxAttempts;
    private final Duration delay;

    private RetryAckFailurePolicy(int maxAttempts, Duration delay) {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("The number of attempts must be at least 1");
      }
      if (delay == null || delay.isNegative()) {
        throw new IllegalArgumentException("The delay must be positive or zero");
      }
      this.maxAttempts = maxAttempts;
      this.delay = delay;
    }

    @Override
    public Duration delay(int failedAttempts) {
      return failedAttempts >= maxAttempts ? GIVE_UP : delay;
    }

    @Override
    public String toString() {
      return "RetryAckFailurePolicy{" + "maxAttempts=" + maxAttempts + ", delay=" + delay + '}';
    }
  }
}
