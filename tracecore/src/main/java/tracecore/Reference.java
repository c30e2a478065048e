/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore;

/**
 * A causal link from a span being started to a context that already exists.
 *
 * @param <C> the context type of the tracer that started the referenced span
 */
//@Immutable
public final class Reference<C extends SpanContext> {
  public enum Kind {
    /** The referenced span depends on the result of the new span. */
    CHILD_OF,
    /** The referenced span does not wait for the new span. */
    FOLLOWS_FROM
  }

  public static <C extends SpanContext> Reference<C> childOf(C context) {
    return new Reference<>(Kind.CHILD_OF, context);
  }

  public static <C extends SpanContext> Reference<C> followsFrom(C context) {
    return new Reference<>(Kind.FOLLOWS_FROM, context);
  }

  final Kind kind;
  final C context;

  Reference(Kind kind, C context) {
    if (context == null) throw new NullPointerException("context == null");
    this.kind = kind;
    this.context = context;
  }

  public Kind kind() {
    return kind;
  }

  public C context() {
    return context;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Reference)) return false;
    Reference<?> that = (Reference<?>) o;
    return kind == that.kind && context.equals(that.context);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= kind.hashCode();
    h *= 1000003;
    h ^= context.hashCode();
    return h;
  }

  @Override public String toString() {
    return kind == Kind.CHILD_OF ? "ChildOf(" + context + ")" : "FollowsFrom(" + context + ")";
  }
}
