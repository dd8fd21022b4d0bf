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
import static com.rabbitmq.worker.impl.TestUtils.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.gson.reflect.TypeToken;
import com.rabbitmq.worker.AckFailurePolicy;
import com.rabbitmq.worker.Delivery;
import com.rabbitmq.worker.PayloadCodec;
import com.rabbitmq.worker.Resolution;
import com.rabbitmq.worker.ResolutionChannel;
import com.rabbitmq.worker.ResolutionException;
import com.rabbitmq.worker.codec.JsonPayloadCodec;
import com.rabbitmq.worker.metrics.MetricsCollector;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class MessageConsumerTest {

  static final long TAG = 12345L;

  @Mock ResolutionChannel channel;
  @Mock MetricsCollector metricsCollector;
  @Mock PayloadCodec<Object> mockCodec;

  AutoCloseable mocks;
  PayloadCodec<Map<String, Object>> codec =
      new JsonPayloadCodec<>(new TypeToken<Map<String, Object>>() {});

  @BeforeEach
  void init() {
    mocks = MockitoAnnotations.openMocks(this);
  }

  @AfterEach
  void tearDown() throws Exception {
    mocks.close();
  }

  MessageConsumer consumer() {
    return consumer(AckFailurePolicy.rejectDrop());
  }

  MessageConsumer consumer(AckFailurePolicy policy) {
    return new MessageConsumer(policy, metricsCollector);
  }

  @Test
  void consumeShouldNotResolveWhenAckIsFalse() {
    Map<String, Object> message =
        consumer().consume(new Delivery(TAG, utf8(FOO_BAR), channel), codec, false);
    assertThat(message).containsEntry("foo", "bar").hasSize(1);
    verifyNoInteractions(channel);
  }

  @Test
  void consumeShouldAckAndReturnDecodedMessageWhenAckIsTrue() {
    Map<String, Object> message =
        consumer().consume(new Delivery(TAG, utf8(FOO_BAR), channel), codec, true);
    assertThat(message).isEqualTo(Collections.singletonMap("foo", "bar"));
    verify(channel, times(1)).ack(TAG);
    verify(channel, never()).reject(anyLong(), anyBoolean());
    verify(metricsCollector, times(1)).acked();
  }

  @Test
  void consumeShouldPassBodyToCodec() {
    byte[] body = new byte[] {1, 2, 3};
    when(mockCodec.decode(body)).thenReturn(1);
    Object message = consumer().consume(new Delivery(TAG, body, channel), mockCodec, true);
    assertThat(message).isEqualTo(1);
    verify(mockCodec, times(1)).decode(body);
    verify(channel, times(1)).ack(TAG);
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void consumeShouldRejectWithoutRequeuingWhenBodyCannotBeDecoded(boolean ack) {
    Map<String, Object> message =
        consumer().consume(new Delivery(TAG, new byte[12345], channel), codec, ack);
    assertThat(message).isNull();
    verify(channel, times(1)).reject(TAG, false);
    verify(channel, never()).ack(anyLong());
    verify(metricsCollector, times(1)).deserializationFailed();
    verify(metricsCollector, times(1)).rejected(false);
  }

  @Test
  void consumeShouldRejectWhenCodecFailsUnexpectedly() {
    when(mockCodec.decode(any())).thenThrow(new IllegalStateException("codec bug"));
    Object message =
        consumer().consume(new Delivery(TAG, utf8(FOO_BAR), channel), mockCodec, false);
    assertThat(message).isNull();
    verify(channel, times(1)).reject(TAG, false);
  }

  @Test
  void consumeShouldRejectWhenCodecReturnsNull() {
    when(mockCodec.decode(any())).thenReturn(null);
    Object message = consumer().consume(new Delivery(TAG, utf8(FOO_BAR), channel), mockCodec, true);
    assertThat(message).isNull();
    verify(channel, times(1)).reject(TAG, false);
    verify(channel, never()).ack(anyLong());
  }

  @Test
  void consumeShouldRejectWithoutRequeuingWhenAckFails() {
    doThrow(new ResolutionException(TAG, Resolution.ACK, new IOException("ack error")))
        .when(channel)
        .ack(TAG);
    Map<String, Object> message =
        consumer().consume(new Delivery(TAG, utf8(FOO_BAR), channel), codec, true);
    assertThat(message).isNull();
    verify(channel, times(1)).ack(TAG);
    verify(channel, times(1)).reject(TAG, false);
    verify(metricsCollector, never()).acked();
  }

  @Test
  void consumeShouldPropagateRejectFailure() {
    doThrow(new ResolutionException(TAG, Resolution.REJECT_DROP, new IOException("closed")))
        .when(channel)
        .reject(TAG, false);
    assertThatThrownBy(
            () -> consumer().consume(new Delivery(TAG, utf8("not json"), channel), codec, false))
        .isInstanceOf(ResolutionException.class)
        .satisfies(
            e -> {
              ResolutionException re = (ResolutionException) e;
              assertThat(re.getDeliveryTag()).isEqualTo(TAG);
              assertThat(re.getResolution()).isEqualTo(Resolution.REJECT_DROP);
            });
  }

  @Test
  void acknowledgeShouldRetryWithRetryPolicy() {
    doThrow(new ResolutionException(TAG, Resolution.ACK, new IOException("transient")))
        .doNothing()
        .when(channel)
        .ack(TAG);
    Map<String, Object> message =
        consumer(AckFailurePolicy.retry(3, Duration.ofMillis(10)))
            .consume(new Delivery(TAG, utf8(FOO_BAR), channel), codec, true);
    assertThat(message).containsEntry("foo", "bar");
    verify(channel, times(2)).ack(TAG);
    verify(channel, never()).reject(anyLong(), anyBoolean());
  }

  @Test
  void acknowledgeShouldRejectOnceRetryAttemptsAreExhausted() {
    doThrow(new ResolutionException(TAG, Resolution.ACK, new IOException("ack error")))
        .when(channel)
        .ack(TAG);
    boolean acked =
        consumer(AckFailurePolicy.retry(3, Duration.ZERO))
            .acknowledge(new Delivery(TAG, utf8(FOO_BAR), channel));
    assertThat(acked).isFalse();
    verify(channel, times(3)).ack(TAG);
    verify(channel, times(1)).reject(TAG, false);
  }

  @Test
  void acknowledgeShouldRejectWhenPolicyReturnsNegativeDelay() {
    doThrow(new ResolutionException(TAG, Resolution.ACK, new IOException("ack error")))
        .when(channel)
        .ack(TAG);
    boolean acked =
        consumer(failedAttempts -> Duration.ofMillis(-1))
            .acknowledge(new Delivery(TAG, utf8(FOO_BAR), channel));
    assertThat(acked).isFalse();
    verify(channel, times(1)).ack(TAG);
    verify(channel, times(1)).reject(TAG, false);
  }

  @Test
  void consumeShouldRejectWhenPolicyReturnsNoDelay() {
    doThrow(new ResolutionException(TAG, Resolution.ACK, new IOException("ack error")))
        .when(channel)
        .ack(TAG);
    Map<String, Object> message =
        consumer(failedAttempts -> null)
            .consume(new Delivery(TAG, utf8(FOO_BAR), channel), codec, true);
    assertThat(message).isNull();
    verify(channel, times(1)).ack(TAG);
    verify(channel, times(1)).reject(TAG, false);
    verify(metricsCollector, times(1)).rejected(false);
  }

  @Test
  void rejectShouldRequeueWhenAsked() {
    doNothing().when(channel).reject(TAG, true);
    consumer().reject(new Delivery(TAG, utf8(FOO_BAR), channel), true);
    verify(channel, times(1)).reject(TAG, true);
    verify(metricsCollector, times(1)).rejected(true);
  }
}
