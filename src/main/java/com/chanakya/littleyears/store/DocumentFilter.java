package com.chanakya.littleyears.store;

import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural predicate over the top-level fields of a stored record.
 * All conditions must hold; a filter without conditions matches everything.
 */
public final class DocumentFilter {

    public enum Operator {
        EQ,       // field equals value
        CONTAINS  // array field has value as an element
    }

    public record Condition(String field, Operator operator, Object value) {
        public Condition {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(operator, "operator");
        }
    }

    private static final DocumentFilter ALL = new DocumentFilter(List.of());

    private final List<Condition> conditions;

    private DocumentFilter(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    public static DocumentFilter all() {
        return ALL;
    }

    public static DocumentFilter where(String field, Object value) {
        return ALL.and(field, value);
    }

    public DocumentFilter and(String field, Object value) {
        return with(new Condition(field, Operator.EQ, value));
    }

    public DocumentFilter andContains(String field, Object value) {
        return with(new Condition(field, Operator.CONTAINS, value));
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public Query toQuery() {
        Query query = new Query();
        for (Condition condition : conditions) {
            Criteria criteria = Criteria.where(condition.field());
            query.addCriteria(condition.operator() == Operator.EQ
                    ? criteria.is(condition.value())
                    : criteria.in(condition.value()));
        }
        return query;
    }

    private DocumentFilter with(Condition condition) {
        List<Condition> next = new ArrayList<>(conditions);
        next.add(condition);
        return new DocumentFilter(next);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentFilter other)) return false;
        return conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentFilter" + conditions;
    }
}
