package com.example.workflowguard.layout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Left-to-right layered (Sugiyama-style) layout of a directed graph with fixed-size vertices.
 * <p>
 * Steps: reverse DFS back edges to break cycles, rank by longest path from the sources, split edges
 * spanning several ranks with dummy vertices, order each rank by DFS and then barycenter sweeps
 * (keeping the order with fewest crossings), and finally place vertices: x by rank, y at the median
 * of their already placed predecessors, pushed apart to keep the minimum separation.
 * </p>
 * <p>
 * Vertices are indexes {@code 0..vertexCount-1}; the result holds center coordinates. The output
 * depends only on the input order of vertices and edges.
 * </p>
 */
public class LayeredGraphLayout {

    private static final int MAX_SWEEPS = 24;

    private final double vertexWidth;
    private final double vertexHeight;
    private final double rankSeparation;
    private final double vertexSeparation;
    private final double marginX;
    private final double marginY;

    public LayeredGraphLayout(double vertexWidth, double vertexHeight, double rankSeparation,
                              double vertexSeparation, double marginX, double marginY) {
        this.vertexWidth = vertexWidth;
        this.vertexHeight = vertexHeight;
        this.rankSeparation = rankSeparation;
        this.vertexSeparation = vertexSeparation;
        this.marginX = marginX;
        this.marginY = marginY;
    }

    /** Center coordinates of the real (non-dummy) vertices, by vertex index. */
    public record Result(double[] x, double[] y) {
    }

    /**
     * @param edges pairs {@code {source, target}}; self loops and duplicates are ignored
     */
    public Result layout(int vertexCount, List<int[]> edges) {
        if (vertexCount == 0) {
            return new Result(new double[0], new double[0]);
        }
        List<int[]> acyclic = breakCycles(vertexCount, normalize(vertexCount, edges));
        int[] rank = longestPathRanks(vertexCount, acyclic);

        Graph graph = Graph.withDummies(vertexCount, acyclic, rank);
        List<List<Integer>> layers = initialOrder(graph);
        layers = minimizeCrossings(graph, layers);

        double[] centerY = assignY(graph, layers);
        double[] x = new double[vertexCount];
        double[] y = new double[vertexCount];
        double minTop = Double.MAX_VALUE;
        for (int v = 0; v < vertexCount; v++) {
            minTop = Math.min(minTop, centerY[v] - vertexHeight / 2);
        }
        for (int v = 0; v < vertexCount; v++) {
            x[v] = marginX + graph.rank[v] * (vertexWidth + rankSeparation) + vertexWidth / 2;
            y[v] = centerY[v] - minTop + marginY;
        }
        return new Result(x, y);
    }

    private static List<int[]> normalize(int vertexCount, List<int[]> edges) {
        Set<Long> seen = new LinkedHashSet<>();
        List<int[]> result = new ArrayList<>();
        for (int[] edge : edges) {
            int from = edge[0];
            int to = edge[1];
            if (from == to || from < 0 || to < 0 || from >= vertexCount || to >= vertexCount) {
                continue;
            }
            if (seen.add(key(from, to))) {
                result.add(new int[]{from, to});
            }
        }
        return result;
    }

    private static long key(int from, int to) {
        return ((long) from << 32) | (to & 0xffffffffL);
    }

    static List<int[]> breakCycles(int vertexCount, List<int[]> edges) {
        List<List<Integer>> out = successors(vertexCount, edges);
        int[] state = new int[vertexCount];
        Set<Long> backEdges = new LinkedHashSet<>();
        for (int v = 0; v < vertexCount; v++) {
            if (state[v] == 0) {
                findBackEdges(v, out, state, backEdges);
            }
        }
        Set<Long> seen = new LinkedHashSet<>();
        List<int[]> result = new ArrayList<>();
        for (int[] edge : edges) {
            int[] directed = backEdges.contains(key(edge[0], edge[1])) ? new int[]{edge[1], edge[0]} : edge;
            if (seen.add(key(directed[0], directed[1]))) {
                result.add(directed);
            }
        }
        return result;
    }

    // state: 0 unvisited, 1 on stack, 2 done
    private static void findBackEdges(int v, List<List<Integer>> out, int[] state, Set<Long> backEdges) {
        state[v] = 1;
        for (int w : out.get(v)) {
            if (state[w] == 1) {
                backEdges.add(key(v, w));
            } else if (state[w] == 0) {
                findBackEdges(w, out, state, backEdges);
            }
        }
        state[v] = 2;
    }

    static int[] longestPathRanks(int vertexCount, List<int[]> edges) {
        List<List<Integer>> out = successors(vertexCount, edges);
        int[] inDegree = new int[vertexCount];
        for (int[] edge : edges) {
            inDegree[edge[1]]++;
        }
        int[] rank = new int[vertexCount];
        List<Integer> queue = new ArrayList<>();
        for (int v = 0; v < vertexCount; v++) {
            if (inDegree[v] == 0) {
                queue.add(v);
            }
        }
        for (int i = 0; i < queue.size(); i++) {
            int v = queue.get(i);
            for (int w : out.get(v)) {
                rank[w] = Math.max(rank[w], rank[v] + 1);
                if (--inDegree[w] == 0) {
                    queue.add(w);
                }
            }
        }
        return rank;
    }

    private static List<List<Integer>> successors(int vertexCount, List<int[]> edges) {
        List<List<Integer>> out = new ArrayList<>(vertexCount);
        for (int v = 0; v < vertexCount; v++) {
            out.add(new ArrayList<>());
        }
        for (int[] edge : edges) {
            out.get(edge[0]).add(edge[1]);
        }
        return out;
    }

    private static List<List<Integer>> initialOrder(Graph graph) {
        List<List<Integer>> layers = new ArrayList<>();
        for (int r = 0; r <= graph.maxRank; r++) {
            layers.add(new ArrayList<>());
        }
        boolean[] visited = new boolean[graph.size()];
        Integer[] byRank = new Integer[graph.size()];
        for (int v = 0; v < byRank.length; v++) {
            byRank[v] = v;
        }
        Arrays.sort(byRank, Comparator.comparingInt(v -> graph.rank[v]));
        for (int v : byRank) {
            placeDepthFirst(v, graph, visited, layers);
        }
        return layers;
    }

    private static void placeDepthFirst(int v, Graph graph, boolean[] visited, List<List<Integer>> layers) {
        if (visited[v]) {
            return;
        }
        visited[v] = true;
        layers.get(graph.rank[v]).add(v);
        for (int w : graph.successors.get(v)) {
            placeDepthFirst(w, graph, visited, layers);
        }
    }

    private static List<List<Integer>> minimizeCrossings(Graph graph, List<List<Integer>> layers) {
        List<List<Integer>> best = copy(layers);
        int bestCrossings = crossings(graph, best);
        List<List<Integer>> current = copy(layers);
        for (int sweep = 0; sweep < MAX_SWEEPS && bestCrossings > 0; sweep++) {
            boolean down = sweep % 2 == 0;
            if (down) {
                for (int r = 1; r < current.size(); r++) {
                    reorder(current.get(r), current.get(r - 1), graph.predecessors, graph.size());
                }
            } else {
                for (int r = current.size() - 2; r >= 0; r--) {
                    reorder(current.get(r), current.get(r + 1), graph.successors, graph.size());
                }
            }
            int count = crossings(graph, current);
            if (count < bestCrossings) {
                bestCrossings = count;
                best = copy(current);
            }
        }
        return best;
    }

    /** Stable sort of {@code layer} by the mean position of each vertex's neighbours in {@code fixed}. */
    private static void reorder(List<Integer> layer, List<Integer> fixed, List<List<Integer>> neighbours, int size) {
        int[] position = positions(fixed, size);
        double[] barycenter = new double[size];
        for (int i = 0; i < layer.size(); i++) {
            int v = layer.get(i);
            double sum = 0;
            int count = 0;
            for (int w : neighbours.get(v)) {
                if (position[w] >= 0) {
                    sum += position[w];
                    count++;
                }
            }
            barycenter[v] = count > 0 ? sum / count : i;
        }
        layer.sort(Comparator.comparingDouble(v -> barycenter[v]));
    }

    private static int crossings(Graph graph, List<List<Integer>> layers) {
        int total = 0;
        for (int r = 0; r + 1 < layers.size(); r++) {
            int[] upper = positions(layers.get(r), graph.size());
            int[] lower = positions(layers.get(r + 1), graph.size());
            List<int[]> segments = new ArrayList<>();
            for (int v : layers.get(r)) {
                for (int w : graph.successors.get(v)) {
                    segments.add(new int[]{upper[v], lower[w]});
                }
            }
            for (int i = 0; i < segments.size(); i++) {
                for (int j = i + 1; j < segments.size(); j++) {
                    int[] a = segments.get(i);
                    int[] b = segments.get(j);
                    if ((a[0] < b[0] && a[1] > b[1]) || (a[0] > b[0] && a[1] < b[1])) {
                        total++;
                    }
                }
            }
        }
        return total;
    }

    private double[] assignY(Graph graph, List<List<Integer>> layers) {
        double[] y = new double[graph.size()];
        for (List<Integer> layer : layers) {
            double previousBottom = Double.NEGATIVE_INFINITY;
            double previousHeight = 0;
            for (int v : layer) {
                double height = height(graph, v);
                double desired = median(graph.predecessors.get(v), y);
                double minimum = previousBottom == Double.NEGATIVE_INFINITY
                        ? Double.NEGATIVE_INFINITY
                        : previousBottom + (previousHeight + height) / 2 + vertexSeparation;
                double placed;
                if (Double.isNaN(desired)) {
                    placed = minimum == Double.NEGATIVE_INFINITY ? 0 : minimum;
                } else {
                    placed = Math.max(desired, minimum);
                }
                y[v] = placed;
                previousBottom = placed;
                previousHeight = height;
            }
        }
        return y;
    }

    private double height(Graph graph, int v) {
        return graph.isDummy(v) ? 0 : vertexHeight;
    }

    private static double median(List<Integer> vertices, double[] y) {
        if (vertices.isEmpty()) {
            return Double.NaN;
        }
        double[] values = new double[vertices.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = y[vertices.get(i)];
        }
        Arrays.sort(values);
        int mid = values.length / 2;
        return values.length % 2 == 1 ? values[mid] : (values[mid - 1] + values[mid]) / 2;
    }

    private static int[] positions(List<Integer> layer, int size) {
        int[] position = new int[size];
        Arrays.fill(position, -1);
        for (int i = 0; i < layer.size(); i++) {
            position[layer.get(i)] = i;
        }
        return position;
    }

    private static List<List<Integer>> copy(List<List<Integer>> layers) {
        List<List<Integer>> copy = new ArrayList<>(layers.size());
        for (List<Integer> layer : layers) {
            copy.add(new ArrayList<>(layer));
        }
        return copy;
    }

    /** Proper layered graph: every edge joins adjacent ranks. Indexes from {@code realCount} up are dummies. */
    private static final class Graph {
        private final int realCount;
        private final List<Integer> rankList = new ArrayList<>();
        private final List<List<Integer>> successors = new ArrayList<>();
        private final List<List<Integer>> predecessors = new ArrayList<>();
        private int[] rank;
        private int maxRank;

        private Graph(int realCount) {
            this.realCount = realCount;
        }

        static Graph withDummies(int vertexCount, List<int[]> edges, int[] ranks) {
            Graph graph = new Graph(vertexCount);
            for (int v = 0; v < vertexCount; v++) {
                graph.addVertex(ranks[v]);
            }
            for (int[] edge : edges) {
                int from = edge[0];
                for (int r = ranks[edge[0]] + 1; r < ranks[edge[1]]; r++) {
                    int dummy = graph.addVertex(r);
                    graph.link(from, dummy);
                    from = dummy;
                }
                graph.link(from, edge[1]);
            }
            graph.rank = graph.rankList.stream().mapToInt(Integer::intValue).toArray();
            graph.maxRank = Arrays.stream(graph.rank).max().orElse(0);
            return graph;
        }

        private int addVertex(int r) {
            rankList.add(r);
            successors.add(new ArrayList<>());
            predecessors.add(new ArrayList<>());
            return rankList.size() - 1;
        }

        private void link(int from, int to) {
            successors.get(from).add(to);
            predecessors.get(to).add(from);
        }

        int size() {
            return rankList.size();
        }

        boolean isDummy(int v) {
            return v >= realCount;
        }
    }
}
