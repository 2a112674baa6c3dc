package com.sigcontract.compiler.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Arithmetic relation graph of a constraint model.
 *
 * Records which parameters each constraint's expression reads, and derives
 * ordering edges: a constraint reading parameter {@code p} depends on every
 * constraint whose subject hangs off {@code p}.
 */
public class RelationGraph {

    private static final Logger logger = LoggerFactory.getLogger(RelationGraph.class);

    // constraint id -> parameters its expression reads
    private final Map<String, Set<String>> references = new LinkedHashMap<>();

    // constraint id -> constraint ids that must be checked first
    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();

    /**
     * Builds the graph for the given constraints.
     */
    public static RelationGraph build(List<Constraint> constraints) {
        RelationGraph graph = new RelationGraph();

        // parameter -> constraints establishing its validity
        Map<String, List<String>> establishing = new LinkedHashMap<>();
        for (Constraint constraint : constraints) {
            for (Subject subject : constraint.getSubjects()) {
                List<String> ids = establishing.computeIfAbsent(subject.root(), k -> new ArrayList<>());
                if (!ids.contains(constraint.getId())) {
                    ids.add(constraint.getId());
                }
            }
        }

        for (Constraint constraint : constraints) {
            Set<String> reads = new LinkedHashSet<>();
            if (constraint.getResolved() != null) {
                for (Subject subject : Exprs.referencedSubjects(constraint.getResolved())) {
                    reads.add(subject.root());
                }
            }
            graph.references.put(constraint.getId(), reads);

            Set<String> deps = new LinkedHashSet<>();
            for (String parameter : reads) {
                for (String other : establishing.getOrDefault(parameter, List.of())) {
                    if (!other.equals(constraint.getId())) {
                        deps.add(other);
                    }
                }
            }
            graph.dependencies.put(constraint.getId(), deps);
        }
        return graph;
    }

    /**
     * Parameters read by the constraint's expression.
     */
    public Set<String> getReferences(String constraintId) {
        return references.getOrDefault(constraintId, Collections.emptySet());
    }

    /**
     * Constraints that must be checked before the given one.
     */
    public Set<String> getDependencies(String constraintId) {
        return dependencies.getOrDefault(constraintId, Collections.emptySet());
    }

    public Map<String, Set<String>> getReferences() {
        return Collections.unmodifiableMap(references);
    }

    public Map<String, Set<String>> getDependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    /**
     * Orders the given constraints so that dependencies come first. Ties keep
     * the input order. Members of a dependency cycle keep their input order
     * after everything that can be ordered.
     */
    public List<Constraint> order(List<Constraint> constraints) {
        Map<String, Constraint> byId = new LinkedHashMap<>();
        constraints.forEach(c -> byId.put(c.getId(), c));

        List<Constraint> ordered = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        boolean progress = true;
        while (progress && placed.size() < byId.size()) {
            progress = false;
            for (Constraint candidate : byId.values()) {
                if (placed.contains(candidate.getId())) {
                    continue;
                }
                boolean ready = getDependencies(candidate.getId()).stream()
                        .filter(byId::containsKey)
                        .allMatch(placed::contains);
                if (ready) {
                    ordered.add(candidate);
                    placed.add(candidate.getId());
                    progress = true;
                    // Restart so earlier constraints unblocked by this one keep their position
                    break;
                }
            }
        }

        if (placed.size() < byId.size()) {
            List<String> cyclic = new ArrayList<>();
            for (Constraint remaining : byId.values()) {
                if (placed.add(remaining.getId())) {
                    ordered.add(remaining);
                    cyclic.add(remaining.getId());
                }
            }
            logger.warn("Dependency cycle between constraints {}; keeping declaration order", cyclic);
        }
        return ordered;
    }
}
