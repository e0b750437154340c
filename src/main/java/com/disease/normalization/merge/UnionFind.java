package com.disease.normalization.merge;

/**
 * Disjoint-set forest over vertex indices {@code 0..n-1}, stored in plain
 * arrays. Uses union by rank and path halving.
 */
final class UnionFind {

    private final int[] parent;
    private final byte[] rank;

    UnionFind(int size) {
        this.parent = new int[size];
        this.rank = new byte[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    int find(int vertex) {
        int v = vertex;
        while (parent[v] != v) {
            parent[v] = parent[parent[v]];
            v = parent[v];
        }
        return v;
    }

    /**
     * Joins the sets containing a and b; returns false if they were already joined.
     */
    boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (rank[rootA] < rank[rootB]) {
            parent[rootA] = rootB;
        } else if (rank[rootA] > rank[rootB]) {
            parent[rootB] = rootA;
        } else {
            parent[rootB] = rootA;
            rank[rootA]++;
        }
        return true;
    }

    int size() {
        return parent.length;
    }
}
