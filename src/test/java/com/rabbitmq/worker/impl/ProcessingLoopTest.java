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

import static com.rabbitmq.worker.impl.TestUtils.FOO_BAR;
import static com.rabbitmq.worker.impl.TestUtils.getResponse;
import static com.rabbitmq.worker.impl.TestUtils.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.gson.reflect.TypeToken;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.worker.Environment;
import com.rabbitmq.worker.PayloadCodec;
import com.rabbitmq.worker.ProcessingSummary;
import com.rabbitmq.worker.ResolutionException;
import com.rabbitmq.worker.codec.JsonPayloadCodec;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class ProcessingLoopTest {

  static final String QUEUE = "test-queue";
  static final Map<String, Object> MESSAGE_PAYLOAD = Collections.singletonMap("foo", "bar");

  @Mock Connection connection;
  @Mock Channel channel;

  AutoCloseable mocks;
  Environment environment;
  AtomicLong deliveryTagSequence = new AtomicLong(0);
  PayloadCodec<Map<String, Object>> codec =
      new JsonPayloadCodec<>(new TypeToken<Map<String, Object>>() {});

  @BeforeEach
  void init() throws Exception {
    mocks = MockitoAnnotations.openMocks(this);
    when(connection.createChannel()).thenReturn(channel);
    environment = Environment.builder().connection(connection).build();
  }

  @AfterEach
  void tearDown() throws Exception {
    environment.close();
    mocks.close();
  }

  void queueHoldsFooBarMessages() throws IOException {
    when(channel.basicGet(QUEUE, false))
        .thenAnswer(
            invocation -> getResponse(deliveryTagSequence.incrementAndGet(), utf8(FOO_BAR)));
  }

  @Test
  void processShouldAckEveryMessageWhenProcessingSucceeds() throws Exception {
    queueHoldsFooBarMessages();
    int count = 5;
    List<Map<String, Object>> processed = new CopyOnWriteArrayList<>();
    ProcessingSummary summary =
        environment.processMessages(QUEUE, codec, count, message -> processed.add(message));
    assertThat(processed).hasSize(count).containsOnly(MESSAGE_PAYLOAD);
    verify(channel, times(count)).basicAck(anyLong(), eq(false));
    verify(channel, never()).basicReject(anyLong(), anyBoolean());
    assertThat(summary.fetched()).isEqualTo(count);
    assertThat(summary.acked()).isEqualTo(count);
    assertThat(summary.requeued()).isZero();
    assertThat(summary.dropped()).isZero();
    verify(channel, times(1)).close();
    verify(connection, never()).close();
  }

  @Test
  void processShouldRequeueEveryMessageWhenProcessingFails() throws Exception {
    queueHoldsFooBarMessages();
    int count = 5;
    AtomicInteger calls = new AtomicInteger(0);
    ProcessingSummary summary =
        environment.processMessages(
            QUEUE,
            codec,
            count,
            message -> {
              calls.incrementAndGet();
              throw new Exception("message processing error");
            });
    assertThat(calls).hasValue(count);
    verify(channel, times(count)).basicReject(anyLong(), eq(true));
    verify(channel, never()).basicReject(anyLong(), eq(false));
    verify(channel, never()).basicAck(anyLong(), anyBoolean());
    assertThat(summary.requeued()).isEqualTo(count);
    assertThat(summary.acked()).isZero();
  }

  @Test
  void processShouldResolveEachMessageBeforeFetchingTheNextOne() throws Exception {
    queueHoldsFooBarMessages();
    environment.processMessages(QUEUE, codec, 3, message -> {});
    InOrder inOrder = inOrder(channel);
    for (long tag = 1; tag <= 3; tag++) {
      inOrder.verify(channel).basicGet(QUEUE, false);
      inOrder.verify(channel).basicAck(tag, false);
    }
    inOrder.verify(channel).close();
  }

  @Test
  void processShouldKeepGoingAfterAProcessingFailure() throws Exception {
    queueHoldsFooBarMessages();
    AtomicInteger calls = new AtomicInteger(0);
    ProcessingSummary summary =
        environment.processMessages(
            QUEUE,
            codec,
            3,
            message -> {
              if (calls.incrementAndGet() == 2) {
                throw new IllegalStateException("second message fails");
              }
            });
    assertThat(calls).hasValue(3);
    verify(channel, times(1)).basicAck(1, false);
    verify(channel, times(1)).basicReject(2, true);
    verify(channel, times(1)).basicAck(3, false);
    assertThat(summary.acked()).isEqualTo(2);
    assertThat(summary.requeued()).isEqualTo(1);
  }

  @Test
  void processShouldRequeueAndKeepGoingWhenHandlerThrowsError() throws Exception {
    queueHoldsFooBarMessages();
    AtomicInteger calls = new AtomicInteger(0);
    ProcessingSummary summary =
        environment.processMessages(
            QUEUE,
            codec,
            3,
            message -> {
              if (calls.incrementAndGet() == 1) {
                throw new AssertionError("handler bug");
              }
            });
    assertThat(calls).hasValue(3);
    verify(channel, times(1)).basicReject(1, true);
    verify(channel, times(1)).basicAck(2, false);
    verify(channel, times(1)).basicAck(3, false);
    assertThat(summary.requeued()).isEqualTo(1);
    assertThat(summary.acked()).isEqualTo(2);
  }

  @Test
  void processShouldDropUndecodableMessagesWithoutCallingHandler() throws Exception {
    when(channel.basicGet(QUEUE, false))
        .thenReturn(getResponse(1, new byte[] {(byte) 0xC3, 0x28}))
        .thenReturn(getResponse(2, utf8(FOO_BAR)));
    List<Map<String, Object>> processed = new CopyOnWriteArrayList<>();
    ProcessingSummary summary = environment.processMessages(QUEUE, codec, 2, processed::add);
    assertThat(processed).containsExactly(MESSAGE_PAYLOAD);
    verify(channel, times(1)).basicReject(1, false);
    verify(channel, never()).basicAck(1, false);
    verify(channel, times(1)).basicAck(2, false);
    assertThat(summary.dropped()).isEqualTo(1);
    assertThat(summary.acked()).isEqualTo(1);
  }

  @Test
  void processShouldSkipEmptyFetches() throws Exception {
    when(channel.basicGet(QUEUE, false))
        .thenReturn(null)
        .thenReturn(getResponse(1, utf8(FOO_BAR)))
        .thenReturn(null);
    AtomicInteger calls = new AtomicInteger(0);
    ProcessingSummary summary =
        environment.processMessages(QUEUE, codec, 3, message -> calls.incrementAndGet());
    assertThat(calls).hasValue(1);
    verify(channel, times(3)).basicGet(QUEUE, false);
    assertThat(summary.empty()).isEqualTo(2);
    assertThat(summary.fetched()).isEqualTo(1);
  }

  @Test
  void processShouldDropMessageWhenAckFails() throws Exception {
    when(channel.basicGet(QUEUE, false)).thenReturn(getResponse(1, utf8(FOO_BAR)));
    doThrow(new IOException("ack error")).when(channel).basicAck(1, false);
    ProcessingSummary summary = environment.processMessages(QUEUE, codec, 1, message -> {});
    verify(channel, times(1)).basicAck(1, false);
    verify(channel, times(1)).basicReject(1, false);
    assertThat(summary.acked()).isZero();
    assertThat(summary.dropped()).isEqualTo(1);
  }

  @Test
  void processShouldPropagateRejectFailureAndCloseChannel() throws Exception {
    queueHoldsFooBarMessages();
    doThrow(new IOException("channel closed")).when(channel).basicReject(anyLong(), anyBoolean());
    assertThatThrownBy(
            () ->
                environment.processMessages(
                    QUEUE,
                    codec,
                    3,
                    message -> {
                      throw new Exception("processing error");
                    }))
        .isInstanceOf(ResolutionException.class);
    verify(channel, times(1)).basicGet(QUEUE, false);
    verify(channel, times(1)).close();
  }

  @Test
  void processShouldNotOpenChannelWhenCountIsZero() throws Exception {
    ProcessingSummary summary = environment.processMessages(QUEUE, codec, 0, message -> {});
    assertThat(summary.fetched()).isZero();
    verify(connection, never()).createChannel();
  }

  @Test
  void processShouldRejectInvalidArguments() {
    assertThatThrownBy(() -> environment.processMessages(QUEUE, codec, -1, message -> {}))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> environment.processMessages(QUEUE, codec, 1, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
