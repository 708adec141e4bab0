/*
 * Copyright 2025 Google LLC
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

package com.gatekit.core;

/**
 * GatekitException is the base exception for all Gatekit errors. It carries an
 * error code for programmatic handling and optional structured details.
 */
public class GatekitException extends RuntimeException {

  /** A continuation was invoked more than once by the same middleware. */
  public static final String NEXT_ALREADY_CALLED = "NEXT_ALREADY_CALLED";

  /** A configuration document could not be read or contained invalid values. */
  public static final String INVALID_CONFIG = "INVALID_CONFIG";

  private final String errorCode;
  private final Object details;

  /**
   * Creates a new GatekitException.
   *
   * @param message
   *            the error message
   */
  public GatekitException(String message) {
    this(message, null, null, null);
  }

  /**
   * Creates a new GatekitException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public GatekitException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  /**
   * Creates a new GatekitException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param errorCode
   *            the error code
   * @param details
   *            additional error details
   */
  public GatekitException(String message, Throwable cause, String errorCode, Object details) {
    super(message, cause);
    this.errorCode = errorCode;
    this.details = details;
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
   * Creates a builder for GatekitException.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for GatekitException.
   */
  public static class Builder {
    private String message;
    private Throwable cause;
    private String errorCode;
    private Object details;

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

    public GatekitException build() {
      if (message == null || message.isEmpty()) {
        throw new IllegalStateException("message is required");
      }
      return new GatekitException(message, cause, errorCode, details);
    }
  }
}
