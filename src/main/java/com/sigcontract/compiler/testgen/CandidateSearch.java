package com.sigcontract.compiler.testgen;

import java.util.*;
import java.util.function.Predicate;

/**
 * Bounded search over an {@link InputSpace}. Each dimension walks a fixed
 * ladder of values; points are visited in order of increasing total ladder
 * position, so the first match is built from the earliest rungs of every
 * ladder at once.
 */
final class CandidateSearch {

    enum Ladder {
        /** Small values first, for boundary and violation cases. */
        EXTREMAL,
        /** Mid-sized values first, for happy-path cases. */
        TYPICAL
    }

    record Candidate(Map<String, Long> point, Map<String, Object> inputs) {
    }

    private final InputSpace space;
    private final int maxCandidates;
    private final int rangeMax;
    private int examined;

    CandidateSearch(InputSpace space, TestSynthesisOptions options) {
        this.space = space;
        this.maxCandidates = options.getMaxCandidates();
        this.rangeMax = options.getRangeMax();
    }

    /**
     * Points examined by the most recent {@link #find} call.
     */
    int examined() {
        return examined;
    }

    Optional<Candidate> find(List<InputSpace.Dimension> dimensions, Ladder ladder, Predicate<Candidate> accept) {
        examined = 0;
        long[][] ladders = new long[dimensions.size()][];
        int maxLevel = 0;
        for (int d = 0; d < dimensions.size(); d++) {
            ladders[d] = values(dimensions.get(d).role(), ladder);
            maxLevel += ladders[d].length - 1;
        }
        // capacity[d]: largest index sum the dimensions from d onwards can reach
        int[] capacity = new int[dimensions.size() + 1];
        for (int d = dimensions.size() - 1; d >= 0; d--) {
            capacity[d] = capacity[d + 1] + ladders[d].length - 1;
        }
        int[] indices = new int[dimensions.size()];
        for (int level = 0; level <= maxLevel && examined < maxCandidates; level++) {
            Candidate found = visit(dimensions, ladders, capacity, indices, 0, level, accept);
            if (found != null) {
                return Optional.of(found);
            }
        }
        return Optional.empty();
    }

    private Candidate visit(List<InputSpace.Dimension> dimensions, long[][] ladders, int[] capacity, int[] indices,
                            int dimension, int remaining, Predicate<Candidate> accept) {
        if (examined >= maxCandidates || remaining > capacity[dimension]) {
            return null;
        }
        if (dimension == dimensions.size()) {
            return remaining == 0 ? test(dimensions, ladders, indices, accept) : null;
        }
        int last = Math.min(remaining, ladders[dimension].length - 1);
        for (int i = 0; i <= last; i++) {
            indices[dimension] = i;
            Candidate found = visit(dimensions, ladders, capacity, indices, dimension + 1, remaining - i, accept);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private Candidate test(List<InputSpace.Dimension> dimensions, long[][] ladders, int[] indices,
                           Predicate<Candidate> accept) {
        examined++;
        Map<String, Long> point = new LinkedHashMap<>();
        for (int d = 0; d < dimensions.size(); d++) {
            point.put(dimensions.get(d).name(), ladders[d][indices[d]]);
        }
        Optional<Map<String, Object>> inputs = space.build(point);
        if (inputs.isEmpty()) {
            return null;
        }
        Candidate candidate = new Candidate(point, inputs.get());
        return accept.test(candidate) ? candidate : null;
    }

    /**
     * The point moved one step along a dimension, if it still yields inputs.
     */
    Optional<Candidate> neighbour(Candidate candidate, String dimension, long step) {
        return shifted(candidate, Map.of(dimension, step));
    }

    /**
     * The point moved by an offset along each given dimension, if it still yields inputs.
     */
    Optional<Candidate> shifted(Candidate candidate, Map<String, Long> offsets) {
        Map<String, Long> point = new LinkedHashMap<>(candidate.point());
        offsets.forEach((dimension, offset) -> point.put(dimension, point.getOrDefault(dimension, 0L) + offset));
        return space.build(point).map(inputs -> new Candidate(point, inputs));
    }

    long[] values(InputSpace.Role role, Ladder ladder) {
        List<Long> values = new ArrayList<>();
        switch (role) {
            case PRESENCE:
                return new long[]{1, 0};
            case DELTA:
                return ladder == Ladder.TYPICAL ? new long[]{0} : new long[]{0, -1, 1, -2, 2};
            case SEED:
                return ladder == Ladder.TYPICAL ? new long[]{1, 2, 3, 0, 5} : new long[]{0, 1, -1, 2, 3, 5};
            case SYMBOL:
                if (ladder == Ladder.TYPICAL) {
                    Collections.addAll(values, 2L, 3L, 1L, 4L, 0L);
                }
                for (long v = 0; v <= rangeMax; v++) {
                    values.add(v);
                }
                break;
            default:
                if (ladder == Ladder.TYPICAL) {
                    Collections.addAll(values, 3L, 2L, 4L, 1L, 5L);
                }
                Collections.addAll(values, 0L, 1L, 2L, 3L, -1L, 4L, 5L, -2L);
                for (long v = 6; v <= rangeMax; v++) {
                    values.add(v);
                }
                Collections.addAll(values, (long) rangeMax * 5, (long) rangeMax * 50);
                break;
        }
        return values.stream().distinct().mapToLong(Long::longValue).toArray();
    }
}
