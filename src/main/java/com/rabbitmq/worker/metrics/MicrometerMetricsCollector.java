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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;

/** {@link MetricsCollector} backed by Micrometer counters. */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final Counter fetched;
  private final Counter emptyFetch;
  private final Counter acked;
  private final Counter rejectedRequeue;
  private final Counter rejectedDrop;
  private final Counter deserializationFailed;
  private final Counter processingFailed;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "rabbitmq.worker");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.fetched = registry.counter(prefix + ".fetched", tags);
    this.emptyFetch = registry.counter(prefix + ".empty_fetch", tags);
    this.acked = registry.counter(prefix + ".acked", tags);
    this.rejectedRequeue =
        registry.counter(prefix + ".rejected", Tags.of(tags).and("requeue", "true"));
    this.rejectedDrop =
        registry.counter(prefix + ".rejected", Tags.of(tags).and("requeue", "false"));
    this.deserializationFailed = registry.counter(prefix + ".deserialization_failed", tags);
    this.processingFailed = registry.counter(prefix + ".processing_failed", tags);
  }

  @Override
  public void fetched() {
    fetched.increment();
  }

  @Override
  public void emptyFetch() {
    emptyFetch.increment();
  }

  @Override
  public void acked() {
    acked.increment();
  }

  @Override
  public void rejected(boolean requeue) {
    if (requeue) {
      rejectedRequeue.increment();
    } else {
      rejectedDrop.increment();
    }
  }

  @Override
  public void deserializationFailed() {
    deserializationFailed.increment();
  }

  @Override
  public void processingFailed() {
    processingFailed.increment();
  }
}
