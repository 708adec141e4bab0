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
package com.gatekit.core.middleware;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.gatekit.core.GatekitException;
import com.gatekit.core.Request;
import com.gatekit.core.Response;

/**
 * A read-only view of a chain. Cached chains are handed out as this view so
 * that one caller cannot change the chain every other caller runs.
 */
final class UnmodifiableChain implements Chain {

  private final Chain delegate;

  UnmodifiableChain(Chain delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public Response process(Request request, ChainContext context) throws GatekitException {
    return delegate.process(request, context);
  }

  @Override
  public Response process(Request request, ChainContext context, MiddlewareNext terminal) throws GatekitException {
    return delegate.process(request, context, terminal);
  }

  @Override
  public Chain add(Middleware... units) {
    throw readOnly();
  }

  @Override
  public Chain insert(int position, Middleware... units) {
    throw readOnly();
  }

  @Override
  public boolean remove(String name) {
    throw readOnly();
  }

  @Override
  public Optional<Middleware> get(String name) {
    return delegate.get(name);
  }

  @Override
  public List<Middleware> list() {
    return delegate.list();
  }

  @Override
  public List<String> names() {
    return List.copyOf(delegate.names());
  }

  @Override
  public Chain clear() {
    throw readOnly();
  }

  @Override
  public int length() {
    return delegate.length();
  }

  @Override
  public Chain copy() {
    return delegate.copy();
  }

  @Override
  public String toString() {
    return "UnmodifiableChain" + delegate.names();
  }

  private static UnsupportedOperationException readOnly() {
    return new UnsupportedOperationException("cached chains are read-only; use copy()");
  }
}
