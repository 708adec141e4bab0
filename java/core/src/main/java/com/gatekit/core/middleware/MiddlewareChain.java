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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import com.gatekit.core.GatekitException;
import com.gatekit.core.Request;
import com.gatekit.core.Response;

/**
 * MiddlewareChain is the default {@link Chain}. It implements the chain of
 * responsibility pattern where each unit can process, short-circuit, or
 * decorate the request and response.
 *
 * <p>
 * The unit list is copy-on-write: each call to {@code process} runs against
 * the snapshot current when it started, so concurrent execution is safe even
 * while another thread mutates the chain.
 */
public class MiddlewareChain implements Chain {

  private final Object mutationLock = new Object();
  private volatile List<Middleware> units;

  /**
   * Creates a new, empty MiddlewareChain.
   */
  public MiddlewareChain() {
    this.units = List.of();
  }

  /**
   * Creates a new MiddlewareChain with the given units, in the given order.
   *
   * @param units
   *            the initial units
   */
  public MiddlewareChain(Collection<? extends Middleware> units) {
    this.units = List.copyOf(units);
  }

  /**
   * Creates a new MiddlewareChain with the specified units.
   *
   * @param units
   *            the units to include
   * @return a new MiddlewareChain
   */
  public static MiddlewareChain of(Middleware... units) {
    return new MiddlewareChain(Arrays.asList(units));
  }

  @Override
  public Response process(Request request, ChainContext context) throws GatekitException {
    return dispatch(units, 0, request, context, null);
  }

  @Override
  public Response process(Request request, ChainContext context, MiddlewareNext terminal) throws GatekitException {
    return dispatch(units, 0, request, context, terminal);
  }

  private Response dispatch(List<Middleware> snapshot, int index, Request request, ChainContext context,
      MiddlewareNext terminal) throws GatekitException {
    if (index >= snapshot.size()) {
      return terminal != null ? terminal.apply(request, context) : null;
    }

    Middleware current = snapshot.get(index);
    AtomicBoolean called = new AtomicBoolean();

    MiddlewareNext next = (modifiedRequest, modifiedContext) -> {
      if (!called.compareAndSet(false, true)) {
        throw GatekitException.builder()
            .message("Middleware " + current.getName() + " called next more than once")
            .errorCode(GatekitException.NEXT_ALREADY_CALLED).details(current.getName()).build();
      }
      return dispatch(snapshot, index + 1, modifiedRequest != null ? modifiedRequest : request,
          modifiedContext != null ? modifiedContext : context, terminal);
    };

    return current.handle(request, context, next);
  }

  @Override
  public MiddlewareChain add(Middleware... added) {
    return insert(-1, added);
  }

  @Override
  public MiddlewareChain insert(int position, Middleware... inserted) {
    List<Middleware> toInsert = new ArrayList<>();
    for (Middleware unit : inserted) {
      toInsert.add(Objects.requireNonNull(unit, "unit"));
    }
    synchronized (mutationLock) {
      List<Middleware> updated = new ArrayList<>(units);
      if (position < 0 || position > updated.size()) {
        updated.addAll(toInsert);
      } else {
        updated.addAll(position, toInsert);
      }
      units = List.copyOf(updated);
    }
    return this;
  }

  @Override
  public boolean remove(String name) {
    synchronized (mutationLock) {
      List<Middleware> updated = new ArrayList<>(units);
      for (int i = 0; i < updated.size(); i++) {
        if (updated.get(i).getName().equals(name)) {
          updated.remove(i);
          units = List.copyOf(updated);
          return true;
        }
      }
      return false;
    }
  }

  @Override
  public Optional<Middleware> get(String name) {
    return units.stream().filter(unit -> unit.getName().equals(name)).findFirst();
  }

  @Override
  public List<Middleware> list() {
    return units;
  }

  @Override
  public List<String> names() {
    List<Middleware> snapshot = units;
    List<String> names = new ArrayList<>(snapshot.size());
    for (Middleware unit : snapshot) {
      names.add(unit.getName());
    }
    return names;
  }

  @Override
  public MiddlewareChain clear() {
    synchronized (mutationLock) {
      units = List.of();
    }
    return this;
  }

  @Override
  public int length() {
    return units.size();
  }

  @Override
  public MiddlewareChain copy() {
    return new MiddlewareChain(units);
  }

  @Override
  public String toString() {
    return "MiddlewareChain" + names();
  }
}
