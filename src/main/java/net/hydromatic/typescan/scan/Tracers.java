/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.typescan.scan;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.typescan.util.Static.str;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.typescan.type.TypeNode;
import net.hydromatic.typescan.type.TypeParameter;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes a line to a writer for each event. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /** Returns a tracer that writes a line to a stream for each event. */
  public static Tracer printTracer(OutputStream stream) {
    return printTracer(new PrintWriter(stream));
  }

  /**
   * Returns a tracer that performs the given action on each candidate, then
   * calls the underlying tracer.
   */
  public static Tracer withOnCandidate(
      Tracer tracer, Consumer<TypeNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCandidate(TypeNode type) {
        consumer.accept(type);
        super.onCandidate(type);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each rejected type,
   * then calls the underlying tracer.
   */
  public static Tracer withOnReject(
      Tracer tracer, BiConsumer<TypeNode, Stage> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onReject(TypeNode type, Stage stage) {
        consumer.accept(type, stage);
        super.onReject(type, stage);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each match, then
   * calls the underlying tracer.
   */
  public static Tracer withOnMatch(Tracer tracer, Consumer<Match> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onMatch(Match match) {
        consumer.accept(match);
        super.onMatch(match);
      }
    };
  }

  public static Tracer withOnCycle(
      Tracer tracer, BiConsumer<TypeParameter, TypeNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCycle(TypeParameter parameter, TypeNode type) {
        consumer.accept(parameter, type);
        super.onCycle(parameter, type);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onCandidate(TypeNode type) {}

    @Override
    public void onReject(TypeNode type, Stage stage) {}

    @Override
    public void onMatch(Match match) {}

    @Override
    public void onCycle(TypeParameter parameter, TypeNode type) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onCandidate(TypeNode type) {
      tracer.onCandidate(type);
    }

    @Override
    public void onReject(TypeNode type, Stage stage) {
      tracer.onReject(type, stage);
    }

    @Override
    public void onMatch(Match match) {
      tracer.onMatch(match);
    }

    @Override
    public void onCycle(TypeParameter parameter, TypeNode type) {
      tracer.onCycle(parameter, type);
    }
  }

  /** Tracer that writes to a given {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final StringBuilder b = new StringBuilder();
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void flush() {
      w.println(str(b));
      w.flush();
    }

    @Override
    public void onCandidate(TypeNode type) {
      b.append("candidate ").append(type);
      flush();
    }

    @Override
    public void onReject(TypeNode type, Stage stage) {
      b.append("reject ").append(type).append(' ').append(stage);
      flush();
    }

    @Override
    public void onMatch(Match match) {
      b.append("match ").append(match);
      flush();
    }

    @Override
    public void onCycle(TypeParameter parameter, TypeNode type) {
      b.append("cycle ").append(parameter).append(' ').append(type);
      flush();
    }
  }
}

// End Tracers.java
