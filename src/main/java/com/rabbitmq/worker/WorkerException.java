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
 * Generic queue worker exception.
 *
 * @see DeserializationException
 * @see ResolutionException
 */
public class WorkerException extends RuntimeException {

  private static final long serialVersionUID = -3516298074316120391L;

  public WorkerException(String message) {
    super(message);
  }

  public WorkerException(Throwable cause) {
    super(null, cause);
  }

  public WorkerException(String message, Throwable cause) {
    super(message, cause);
  }
}
