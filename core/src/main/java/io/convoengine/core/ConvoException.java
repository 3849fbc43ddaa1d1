/*
 * Copyright 2025 The ConvoEngine Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.convoengine.core;

/**
 * ConvoException is the base exception for all ConvoEngine errors. It carries
 * an optional error code, free-form details and the conversation the failure
 * belongs to, since every error in the engine is scoped to one conversation.
 */
public class ConvoException extends RuntimeException {

  private final String errorCode;
  private final Object details;
  private final String conversationId;

  /**
   * Creates a new ConvoException.
   *
   * @param message
   *            the error message
   */
  public ConvoException(String message) {
    this(message, null, null, null, null);
  }

  /**
   * Creates a new ConvoException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public ConvoException(String message, Throwable cause) {
    this(message, cause, null, null, null);
  }

  /**
   * Creates a new ConvoException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param errorCode
   *            the error code
   * @param details
   *            additional error details
   * @param conversationId
   *            the conversation the error belongs to
   */
  public ConvoException(String message, Throwable cause, String errorCode, Object details, String conversationId) {
    super(message, cause);
    this.errorCode = errorCode;
    this.details = details;
    this.conversationId = conversationId;
  }

  /**
   * Returns the error code.
   *
   * @return the error code, or null if not set
   */
  public String getErrorCode() {
    return errorCode;
  }

  /**
   * Returns additional error details.
   *
   * @return the error details, or null if not set
   */
  public Object getDetails() {
    return details;
  }

  /**
   * Returns the conversation this error is scoped to.
   *
   * @return the conversation id, or null if not tied to one
   */
  public String getConversationId() {
    return conversationId;
  }

  /**
   * Creates a builder for ConvoException.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for ConvoException.
   */
  public static class Builder {
    private String message;
    private Throwable cause;
    private String errorCode;
    private Object details;
    private String conversationId;

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder cause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    public Builder errorCode(String errorCode) {
      this.errorCode = errorCode;
      return this;
    }

    public Builder details(Object details) {
      this.details = details;
      return this;
    }

    public Builder conversationId(String conversationId) {
      this.conversationId = conversationId;
      return this;
    }

    public ConvoException build() {
      if (message == null || message.isEmpty()) {
        throw new IllegalStateException("message is required");
      }
      return new ConvoException(message, cause, errorCode, details, conversationId);
    }
  }
}
