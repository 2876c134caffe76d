package com.company.cropstress.service;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * Isolation forest over dense feature rows. Each tree is grown on a sub-sample drawn without
 * replacement, splitting on a random non-constant attribute at a uniform threshold.
 */
final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final List<Node> trees;
    private final int subsampleSize;

    private IsolationForest(List<Node> trees, int subsampleSize) {
        this.trees = trees;
        this.subsampleSize = subsampleSize;
    }

    static IsolationForest fit(double[][] data, int treeCount, int maxSubsample, RandomGenerator random) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Isolation forest needs at least one sample");
        }
        int psi = Math.min(maxSubsample, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));

        List<Node> trees = new ArrayList<>(treeCount);
        int[] indices = new int[data.length];
        for (int t = 0; t < treeCount; t++) {
            for (int i = 0; i < indices.length; i++) {
                indices[i] = i;
            }
            // partial Fisher-Yates: first psi slots become the sample
            for (int i = 0; i < psi; i++) {
                int j = i + random.nextInt(indices.length - i);
                int tmp = indices[i];
                indices[i] = indices[j];
                indices[j] = tmp;
            }
            int[] sample = new int[psi];
            System.arraycopy(indices, 0, sample, 0, psi);
            trees.add(grow(data, sample, 0, heightLimit, random));
        }
        return new IsolationForest(trees, psi);
    }

    /**
     * {@code 2^(-E[h(x)] / c(psi))}; values close to 1 are easy to isolate.
     */
    double score(double[] x) {
        double total = 0.0;
        for (Node tree : trees) {
            total += pathLength(tree, x, 0);
        }
        double mean = total / trees.size();
        double normalizer = averagePathLength(subsampleSize);
        if (normalizer == 0.0) {
            return 0.5;
        }
        return Math.pow(2.0, -mean / normalizer);
    }

    /**
     * Average unsuccessful-search path length of a binary search tree over n points.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static Node grow(double[][] data, int[] rows, int depth, int heightLimit, RandomGenerator random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }

        int dims = data[rows[0]].length;
        List<Integer> candidates = new ArrayList<>(dims);
        double[] min = new double[dims];
        double[] max = new double[dims];
        for (int d = 0; d < dims; d++) {
            double lo = Double.POSITIVE_INFINITY;
            double hi = Double.NEGATIVE_INFINITY;
            for (int row : rows) {
                lo = Math.min(lo, data[row][d]);
                hi = Math.max(hi, data[row][d]);
            }
            min[d] = lo;
            max[d] = hi;
            if (hi > lo) {
                candidates.add(d);
            }
        }
        if (candidates.isEmpty()) {
            return Node.leaf(rows.length);
        }

        int attribute = candidates.get(random.nextInt(candidates.size()));
        double split = min[attribute] + random.nextDouble() * (max[attribute] - min[attribute]);

        int leftCount = 0;
        for (int row : rows) {
            if (data[row][attribute] < split) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[rows.length - leftCount];
        int l = 0;
        int r = 0;
        for (int row : rows) {
            if (data[row][attribute] < split) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }

        return Node.split(attribute, split,
                grow(data, left, depth + 1, heightLimit, random),
                grow(data, right, depth + 1, heightLimit, random));
    }

    private static double pathLength(Node node, double[] x, int depth) {
        if (node.leaf) {
            return depth + averagePathLength(node.size);
        }
        Node next = x[node.attribute] < node.threshold ? node.left : node.right;
        return pathLength(next, x, depth + 1);
    }

    private static final class Node {
        final boolean leaf;
        final int size;
        final int attribute;
        final double threshold;
        final Node left;
        final Node right;

        private Node(boolean leaf, int size, int attribute, double threshold, Node left, Node right) {
            this.leaf = leaf;
            this.size = size;
            this.attribute = attribute;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
        }

        static Node leaf(int size) {
            return new Node(true, size, -1, Double.NaN, null, null);
        }

        static Node split(int attribute, double threshold, Node left, Node right) {
            return new Node(false, 0, attribute, threshold, left, right);
        }
    }
}
