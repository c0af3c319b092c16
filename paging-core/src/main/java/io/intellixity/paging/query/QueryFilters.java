package io.intellixity.paging.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String property, Object value) { return Condition.of(property, Operator.EQ, value); }
  public static Condition ne(String property, Object value) { return Condition.of(property, Operator.NE, value); }
  public static Condition gt(String property, Object value) { return Condition.of(property, Operator.GT, value); }
  public static Condition ge(String property, Object value) { return Condition.of(property, Operator.GE, value); }
  public static Condition lt(String property, Object value) { return Condition.of(property, Operator.LT, value); }
  public static Condition le(String property, Object value) { return Condition.of(property, Operator.LE, value); }

  public static Condition in(String property, Collection<?> values) { return Condition.of(property, Operator.IN, List.copyOf(values)); }
  public static Condition nin(String property, Collection<?> values) { return Condition.of(property, Operator.NIN, List.copyOf(values)); }

  public static Condition like(String property, String pattern) { return Condition.of(property, Operator.LIKE, pattern); }
  public static Condition ilike(String property, String pattern) { return Condition.of(property, Operator.ILIKE, pattern); }

  /** Case-insensitive substring match: {@code property ILIKE '%text%'}. */
  public static Condition contains(String property, String text) { return ilike(property, "%" + text + "%"); }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static LogicalGroup and(List<? extends QueryElement> elements) {
    return new LogicalGroup(Clause.AND, new ArrayList<>(elements));
  }

  public static LogicalGroup or(List<? extends QueryElement> elements) {
    return new LogicalGroup(Clause.OR, new ArrayList<>(elements));
  }

  public static NotElement not(QueryElement element) {
    return new NotElement(element);
  }

  /**
   * AND-combine two filters, either of which may be null. An existing top-level AND group is
   * flattened instead of nested.
   */
  public static QueryElement merge(QueryElement current, QueryElement extra) {
    if (extra == null) return current;
    if (current == null) return extra;
    List<QueryElement> els = new ArrayList<>();
    if (current instanceof LogicalGroup g && g.clause() == Clause.AND) els.addAll(g.elements());
    else els.add(current);
    els.add(extra);
    return new LogicalGroup(Clause.AND, els);
  }
}
