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

/**
 * Outcome of {@link Environment#processMessages(String, PayloadCodec, int, MessageHandler)}.
 *
 * <p>A fetched message ends up in exactly one of the acked, requeued, or dropped counts.
 */
public final class ProcessingSummary {

  private final int fetched;
  private final int empty;
  private final int acked;
  private final int requeued;
  private final int dropped;

  public ProcessingSummary(int fetched, int empty, int acked, int requeued, int dropped) {
    this.fetched = fetched;
    this.empty = empty;
    this.acked = acked;
    this.requeued = requeued;
    this.dropped = dropped;
  }

  /** @return the number of messages fetched */
  public int fetched() {
    return fetched;
  }

  /** @return the number of fetches that found the queue empty */
  public int empty() {
    return empty;
  }

  /** @return the number of messages processed and acknowledged */
  public int acked() {
    return acked;
  }

  /** @return the number of messages rejected after a processing failure and requeued */
  public int requeued() {
    return requeued;
  }

  /**
   * The number of messages rejected without requeuing, because they could not be decoded or
   * acknowledged.
   *
   * @return the number of dropped messages
   */
  public int dropped() {
    return dropped;
  }

  @Override
  public String toString() {
    return "ProcessingSummary{"
        + "fetched="
        + fetched
        + ", empty="
        + empty
        + ", acked="
        + acked
        + ", requeued="
        + requeued
        + ", dropped="
        + dropped
        + '}';
  }
}
