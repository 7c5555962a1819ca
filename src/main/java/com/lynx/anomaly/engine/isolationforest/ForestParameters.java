package com.lynx.anomaly.engine.isolationforest;

/**
 * @param numTrees      number of trees in the forest (typically 100)
 * @param subsampleSize sub-sampling size per tree (typically min(256, N))
 * @param maxDepth      depth limit; 0 or less selects ceil(log2(subsampleSize))
 * @param bootstrap     draw each subsample with replacement
 * @param seed          random seed for reproducibility
 * @param parallelism   tree-building workers; 0 or less selects available processors
 */
public record ForestParameters(int numTrees, int subsampleSize, int maxDepth,
                               boolean bootstrap, long seed, int parallelism) {

    public ForestParameters {
        if (numTrees <= 0) throw new IllegalArgumentException("numTrees must be positive: " + numTrees);
        if (subsampleSize <= 0) throw new IllegalArgumentException("subsampleSize must be positive: " + subsampleSize);
    }

    public int effectiveParallelism() {
        int workers = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(workers, numTrees));
    }

    public static int defaultMaxDepth(int subsampleSize) {
        return (int) Math.ceil(Math.log(Math.max(subsampleSize, 2)) / Math.log(2));
    }
}
