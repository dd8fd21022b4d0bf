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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.rabbitmq.client.Connection;
import com.rabbitmq.worker.Delivery;
import com.rabbitmq.worker.Environment;
import com.rabbitmq.worker.ResolutionChannel;
import com.rabbitmq.worker.WorkerException;
import com.rabbitmq.worker.codec.BytesPayloadCodec;
import org.junit.jupiter.api.Test;

public class WorkerEnvironmentTest {

  @Test
  void builderShouldRequireConnection() {
    assertThatThrownBy(() -> Environment.builder().build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void builderShouldRejectNullSettings() {
    assertThatThrownBy(() -> Environment.builder().ackFailurePolicy(null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Environment.builder().metricsCollector(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void builderShouldCreateWorkerEnvironment() {
    Environment environment = Environment.builder().connection(mock(Connection.class)).build();
    assertThat(environment).isInstanceOf(WorkerEnvironment.class);
    environment.close();
  }

  @Test
  void consumeMessageShouldWorkWithoutBrokerConnection() {
    Environment environment = Environment.builder().connection(mock(Connection.class)).build();
    ResolutionChannel channel = mock(ResolutionChannel.class);
    byte[] decoded =
        environment.consumeMessage(
            new Delivery(1, new byte[] {1, 2, 3}, channel), new BytesPayloadCodec(), true);
    assertThat(decoded).containsExactly(1, 2, 3);
    verify(channel).ack(1);
    environment.close();
  }

  @Test
  void operationsShouldFailOnceEnvironmentIsClosed() throws Exception {
    Connection connection = mock(Connection.class);
    Environment environment = Environment.builder().connection(connection).build();
    environment.close();
    environment.close();
    BytesPayloadCodec codec = new BytesPayloadCodec();
    assertThatThrownBy(() -> environment.fetchMessages("q", codec, true, 1))
        .isInstanceOf(WorkerException.class);
    assertThatThrownBy(() -> environment.processMessages("q", codec, 1, message -> {}))
        .isInstanceOf(WorkerException.class);
    assertThatThrownBy(() -> environment.subscriberBuilder(codec))
        .isInstanceOf(WorkerException.class);
    assertThatThrownBy(
            () ->
                environment.consumeMessage(
                    new Delivery(1, new byte[0], mock(ResolutionChannel.class)), codec, false))
        .isInstanceOf(WorkerException.class);
    verify(connection, never()).close();
  }
}
