package com.lynx.anomaly.engine.isolationforest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds isolation forests.
 *
 * Each tree gets its own sub-seed, drawn in tree order from a master generator
 * seeded with {@link ForestParameters#seed()}. Trees share no mutable state, so
 * they are built on a worker pool and the result does not depend on the worker
 * count or scheduling.
 */
public class IsolationForestTrainer {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestTrainer.class);

    private final ForestParameters parameters;

    public IsolationForestTrainer(ForestParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Train the isolation forest on the given data.
     *
     * @param data training samples, each row is a feature vector
     */
    public IsolationForest fit(double[][] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on zero samples");
        }
        int sampleSize = Math.min(parameters.subsampleSize(), data.length);
        int maxDepth = parameters.maxDepth() > 0
                ? parameters.maxDepth()
                : ForestParameters.defaultMaxDepth(sampleSize);
        int numTrees = parameters.numTrees();

        Random master = new Random(parameters.seed());
        long[] treeSeeds = new long[numTrees];
        for (int i = 0; i < numTrees; i++) {
            treeSeeds[i] = master.nextLong();
        }

        int workers = parameters.effectiveParallelism();
        log.info("Building {} trees (subsample={}, maxDepth={}, bootstrap={}) on {} workers",
                numTrees, sampleSize, maxDepth, parameters.bootstrap(), workers);

        List<IsolationTree> trees = workers == 1
                ? buildSequential(data, sampleSize, maxDepth, treeSeeds)
                : buildParallel(data, sampleSize, maxDepth, treeSeeds, workers);

        return new IsolationForest(trees, sampleSize);
    }

    private List<IsolationTree> buildSequential(double[][] data, int sampleSize, int maxDepth, long[] seeds) {
        List<IsolationTree> trees = new ArrayList<>(seeds.length);
        for (long seed : seeds) {
            trees.add(buildTree(data, sampleSize, maxDepth, seed));
        }
        return trees;
    }

    private List<IsolationTree> buildParallel(double[][] data, int sampleSize, int maxDepth,
                                              long[] seeds, int workers) {
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "iforest-builder-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<IsolationTree>> futures = new ArrayList<>(seeds.length);
            for (long seed : seeds) {
                futures.add(executor.submit(() -> buildTree(data, sampleSize, maxDepth, seed)));
            }
            // Join barrier: collected in submission order, so tree i always comes from seed i
            List<IsolationTree> trees = new ArrayList<>(seeds.length);
            for (Future<IsolationTree> future : futures) {
                trees.add(future.get());
            }
            return trees;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while building isolation trees", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Failed to build isolation tree", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private IsolationTree buildTree(double[][] data, int sampleSize, int maxDepth, long seed) {
        Random random = new Random(seed);
        double[][] sample = parameters.bootstrap()
                ? sampleWithReplacement(data, sampleSize, random)
                : subsample(data, sampleSize, random);
        return IsolationTree.build(sample, maxDepth, random);
    }

    static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    static double[][] sampleWithReplacement(double[][] data, int size, Random random) {
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            sample[i] = data[random.nextInt(data.length)];
        }
        return sample;
    }
}
