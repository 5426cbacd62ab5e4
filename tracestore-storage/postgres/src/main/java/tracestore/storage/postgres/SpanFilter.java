/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jooq.Comparator;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.impl.DSL;

/**
 * A conjunction of per-span predicates. Values are always bound as parameters, never inlined into
 * the SQL text.
 *
 * @see FilterBuilder
 */
final class SpanFilter {

  /** A typed (column, comparator, value) triple. */
  static final class Predicate<T> {
    final Field<T> column;
    final Comparator comparator;
    final T value;

    Predicate(Field<T> column, Comparator comparator, T value) {
      this.column = column;
      this.comparator = comparator;
      this.value = value;
    }

    Condition toCondition() {
      return column.compare(comparator, value);
    }

    @Override public String toString() {
      return column.getName() + " " + comparator.toSQL() + " " + value;
    }
  }

  final List<Predicate<?>> predicates;

  SpanFilter(List<Predicate<?>> predicates) {
    this.predicates = Collections.unmodifiableList(new ArrayList<>(predicates));
  }

  /** Predicates in the order they were added. Empty means all spans match. */
  List<Predicate<?>> predicates() {
    return predicates;
  }

  /** Returns a condition matching all predicates, or one matching all rows if there are none. */
  Condition condition() {
    if (predicates.isEmpty()) return DSL.noCondition();
    List<Condition> conditions = new ArrayList<>(predicates.size());
    for (Predicate<?> predicate : predicates) conditions.add(predicate.toCondition());
    return DSL.and(conditions);
  }

  /** Renders {@link #condition()} with positional placeholders, matching {@link #bindValues}. */
  String sql(DSLContext context) {
    return context.render(condition());
  }

  List<Object> bindValues(DSLContext context) {
    return context.extractBindValues(condition());
  }

  @Override public String toString() {
    return "SpanFilter" + predicates;
  }
}
