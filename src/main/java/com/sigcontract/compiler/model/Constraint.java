package com.sigcontract.compiler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.*;

/**
 * A single value-level fact extracted from a signature.
 *
 * {@code expression} keeps the symbols of the signature (for restatement and
 * merging); {@code resolved} is the same expression with every symbol replaced
 * by the input it denotes, e.g. {@code n} becomes {@code len(xs)} when {@code n}
 * is implicit.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Constraint {

    public enum Scope {
        PARAMETER, RETURN, CROSS_PARAMETER
    }

    /**
     * Where the constraint came from, which decides the phase it is checked in.
     */
    public enum Origin {
        PARAMETER, RETURN, RECORD_INVARIANT
    }

    private final String id;
    private final ConstraintKind kind;
    private final Scope scope;
    private final Origin origin;
    private final List<Subject> subjects;
    private final Expr expression;
    private final Expr resolved;
    private final String parentId;
    private final String recordName;
    private final Subject recordSubject;

    private Constraint(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.origin = Objects.requireNonNull(builder.origin, "origin");
        this.subjects = List.copyOf(builder.subjects);
        if (subjects.isEmpty()) {
            throw new IllegalArgumentException("Constraint " + id + " has no subject");
        }
        this.scope = builder.scope != null ? builder.scope : deriveScope(origin, subjects);
        this.expression = builder.expression;
        this.resolved = builder.resolved;
        this.parentId = builder.parentId;
        this.recordName = builder.recordName;
        this.recordSubject = builder.recordSubject;
    }

    private static Scope deriveScope(Origin origin, List<Subject> subjects) {
        if (subjects.size() > 1) {
            return Scope.CROSS_PARAMETER;
        }
        return subjects.get(0).root().equals(Subject.RESULT_NAME) ? Scope.RETURN : Scope.PARAMETER;
    }

    public String getId() {
        return id;
    }

    public ConstraintKind getKind() {
        return kind;
    }

    public Scope getScope() {
        return scope;
    }

    public Origin getOrigin() {
        return origin;
    }

    public List<Subject> getSubjects() {
        return subjects;
    }

    /**
     * The first subject; the only one unless the constraint was merged.
     */
    @JsonIgnore
    public Subject getSubject() {
        return subjects.get(0);
    }

    public Expr getExpression() {
        return expression;
    }

    public Expr getResolved() {
        return resolved;
    }

    public String getParentId() {
        return parentId;
    }

    public String getRecordName() {
        return recordName;
    }

    public Subject getRecordSubject() {
        return recordSubject;
    }

    @JsonIgnore
    public boolean isNested() {
        return parentId != null;
    }

    /**
     * Human-readable restatement of the original type-level guarantee.
     */
    public String restate() {
        String subjectText = subjectsText();
        return switch (kind) {
            case NONNEGATIVE -> subjectText + " must be nonnegative (" + subjectText + " ≥ 0)";
            case INDEX_BOUND -> "index must satisfy 0 ≤ " + subjectText + " < " + expression.render();
            case LENGTH_EQUALS -> subjects.size() > 1
                    ? "lengths of " + subjectText + " must all equal " + expression.render()
                    : "length of " + subjectText + " must equal " + expression.render();
            case LENGTH_AT_LEAST -> "length of " + subjectText + " must be at least " + expression.render();
            case PREDICATE_HOLDS -> subjectText + " must satisfy "
                    + Exprs.substitute(expression, Map.of(Expr.SELF, Expr.var(subjectText))).render();
            case DISJOINT -> subjectText + " is either absent or present";
        };
    }

    private String subjectsText() {
        StringJoiner joiner = new StringJoiner(", ");
        subjects.forEach(s -> joiner.add(s.path()));
        return joiner.toString();
    }

    /**
     * Short form used in logs and tests, e.g. {@code LengthAtLeast(xs, n)}.
     */
    public String describe() {
        StringJoiner joiner = new StringJoiner(", ", kind.displayName() + "(", ")");
        subjects.forEach(s -> joiner.add(s.path()));
        if (expression != null) {
            joiner.add(expression.render());
        }
        return joiner.toString();
    }

    /**
     * Copy with a different id and parent, used when ids are assigned after merging.
     */
    public Constraint withIds(String newId, String newParentId) {
        return toBuilder().id(newId).parentId(newParentId).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).kind(kind).scope(scope).origin(origin).subjects(subjects)
                .expression(expression).resolved(resolved).parentId(parentId)
                .record(recordName, recordSubject);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constraint)) return false;
        Constraint that = (Constraint) o;
        return id.equals(that.id) && kind == that.kind && scope == that.scope && origin == that.origin
                && subjects.equals(that.subjects) && Objects.equals(expression, that.expression)
                && Objects.equals(resolved, that.resolved) && Objects.equals(parentId, that.parentId)
                && Objects.equals(recordName, that.recordName) && Objects.equals(recordSubject, that.recordSubject);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, scope, origin, subjects, expression, resolved, parentId, recordName);
    }

    @Override
    public String toString() {
        return id + " " + describe();
    }

    public static final class Builder {
        private String id;
        private ConstraintKind kind;
        private Scope scope;
        private Origin origin = Origin.PARAMETER;
        private List<Subject> subjects = new ArrayList<>();
        private Expr expression;
        private Expr resolved;
        private String parentId;
        private String recordName;
        private Subject recordSubject;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(ConstraintKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder scope(Scope scope) {
            this.scope = scope;
            return this;
        }

        public Builder origin(Origin origin) {
            this.origin = origin;
            return this;
        }

        public Builder subject(Subject subject) {
            this.subjects = new ArrayList<>(List.of(subject));
            return this;
        }

        public Builder subjects(List<Subject> subjects) {
            this.subjects = new ArrayList<>(subjects);
            return this;
        }

        public Builder expression(Expr expression) {
            this.expression = expression;
            return this;
        }

        public Builder resolved(Expr resolved) {
            this.resolved = resolved;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder record(String recordName, Subject recordSubject) {
            this.recordName = recordName;
            this.recordSubject = recordSubject;
            return this;
        }

        public Constraint build() {
            return new Constraint(this);
        }
    }
}
