package com.trendradar.cluster;

/**
 * Disjoint sets over slot indices {@code 0..size-1}, with path halving and union by rank.
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

    int find(int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /**
     * @return true when the two slots were in different sets
     */
    boolean union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) {
            return false;
        }
        if (rank[ra] < rank[rb]) {
            parent[ra] = rb;
        } else if (rank[ra] > rank[rb]) {
            parent[rb] = ra;
        } else {
            parent[rb] = ra;
            rank[ra]++;
        }
        return true;
    }

    boolean connected(int a, int b) {
        return find(a) == find(b);
    }
}
