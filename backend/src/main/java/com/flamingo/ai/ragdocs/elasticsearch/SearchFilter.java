package com.flamingo.ai.ragdocs.elasticsearch;

import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Conjunction of {@code technology in [...]} and {@code category in [...]} clauses. A clause with
 * an empty set is omitted; with both sets empty there is no filter at all.
 */
public record SearchFilter(Set<String> technologies, Set<String> categories) {

  public static final String TECHNOLOGY_FIELD = "technology";
  public static final String CATEGORY_FIELD = "category";

  public SearchFilter {
    technologies = clean(technologies);
    categories = clean(categories);
  }

  public static SearchFilter none() {
    return new SearchFilter(Set.of(), Set.of());
  }

  public static SearchFilter of(Collection<String> technologies, Collection<String> categories) {
    return new SearchFilter(
        technologies == null ? Set.of() : new LinkedHashSet<>(technologies),
        categories == null ? Set.of() : new LinkedHashSet<>(categories));
  }

  public boolean isEmpty() {
    return technologies.isEmpty() && categories.isEmpty();
  }

  /** Human-readable form, e.g. {@code technology in ["milvus"] && category in ["security"]}. */
  public Optional<String> toExpression() {
    List<String> clauses = new ArrayList<>(2);
    if (!technologies.isEmpty()) {
      clauses.add(clause(TECHNOLOGY_FIELD, technologies));
    }
    if (!categories.isEmpty()) {
      clauses.add(clause(CATEGORY_FIELD, categories));
    }
    return clauses.isEmpty() ? Optional.empty() : Optional.of(String.join(" && ", clauses));
  }

  /** Elasticsearch form: a bool filter of {@code terms} queries on the keyword fields. */
  public Optional<Query> toQuery() {
    if (isEmpty()) {
      return Optional.empty();
    }
    List<Query> clauses = new ArrayList<>(2);
    if (!technologies.isEmpty()) {
      clauses.add(terms(TECHNOLOGY_FIELD, technologies));
    }
    if (!categories.isEmpty()) {
      clauses.add(terms(CATEGORY_FIELD, categories));
    }
    return Optional.of(Query.of(q -> q.bool(b -> b.filter(clauses))));
  }

  /** Evaluates the filter against chunk metadata. */
  public boolean matches(String technology, String category) {
    return (technologies.isEmpty() || technologies.contains(technology))
        && (categories.isEmpty() || categories.contains(category));
  }

  private static Query terms(String field, Set<String> values) {
    List<FieldValue> fieldValues = values.stream().map(FieldValue::of).toList();
    return Query.of(q -> q.terms(t -> t.field(field).terms(v -> v.value(fieldValues))));
  }

  private static String clause(String field, Set<String> values) {
    return values.stream()
        .map(v -> "\"" + v.replace("\"", "\\\"") + "\"")
        .collect(Collectors.joining(", ", field + " in [", "]"));
  }

  private static Set<String> clean(Set<String> values) {
    if (values == null) {
      return Set.of();
    }
    Set<String> cleaned = new LinkedHashSet<>();
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        cleaned.add(value.trim());
      }
    }
    return Collections.unmodifiableSet(cleaned);
  }
}
