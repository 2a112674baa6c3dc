package com.sigcontract.compiler.testgen;

/**
 * Knobs of test synthesis. Immutable; the {@code with} methods return copies.
 */
public final class TestSynthesisOptions {

    private static final int DEFAULT_TRIALS = 100;
    private static final long DEFAULT_SEED = 0x5eedL;
    private static final int DEFAULT_MAX_CANDIDATES = 20_000;
    private static final int DEFAULT_RANGE_MAX = 20;
    private static final int DEFAULT_DIFFERENTIAL_SAMPLES = 3;

    private final int trials;
    private final long seed;
    private final int maxCandidates;
    private final int rangeMax;
    private final int differentialSamples;

    private TestSynthesisOptions(int trials, long seed, int maxCandidates, int rangeMax, int differentialSamples) {
        if (trials <= 0 || maxCandidates <= 0 || rangeMax <= 0 || differentialSamples < 0) {
            throw new IllegalArgumentException("Test synthesis options must be positive");
        }
        this.trials = trials;
        this.seed = seed;
        this.maxCandidates = maxCandidates;
        this.rangeMax = rangeMax;
        this.differentialSamples = differentialSamples;
    }

    public static TestSynthesisOptions defaults() {
        return new TestSynthesisOptions(DEFAULT_TRIALS, DEFAULT_SEED, DEFAULT_MAX_CANDIDATES, DEFAULT_RANGE_MAX,
                DEFAULT_DIFFERENTIAL_SAMPLES);
    }

    public TestSynthesisOptions withTrials(int value) {
        return new TestSynthesisOptions(value, seed, maxCandidates, rangeMax, differentialSamples);
    }

    public TestSynthesisOptions withSeed(long value) {
        return new TestSynthesisOptions(trials, value, maxCandidates, rangeMax, differentialSamples);
    }

    public TestSynthesisOptions withMaxCandidates(int value) {
        return new TestSynthesisOptions(trials, seed, value, rangeMax, differentialSamples);
    }

    public TestSynthesisOptions withRangeMax(int value) {
        return new TestSynthesisOptions(trials, seed, maxCandidates, value, differentialSamples);
    }

    public TestSynthesisOptions withDifferentialSamples(int value) {
        return new TestSynthesisOptions(trials, seed, maxCandidates, rangeMax, value);
    }

    /** Trials per property-based case. */
    public int getTrials() {
        return trials;
    }

    public long getSeed() {
        return seed;
    }

    /** Candidate inputs examined per search before giving up. */
    public int getMaxCandidates() {
        return maxCandidates;
    }

    /** Upper end of generated integer ranges. */
    public int getRangeMax() {
        return rangeMax;
    }

    /** Differential cases drawn per property case when a reference is present. */
    public int getDifferentialSamples() {
        return differentialSamples;
    }
}
