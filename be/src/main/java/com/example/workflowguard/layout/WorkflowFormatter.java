package com.example.workflowguard.layout;

import com.example.workflowguard.domain.Connections;
import com.example.workflowguard.domain.JsonValues;
import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.Position;
import com.example.workflowguard.domain.Workflow;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes node positions like the editor's "tidy up" and drops null-valued parameter keys.
 * <p>
 * Nodes are laid out left to right with triggers in the first column. Afterwards the node list is
 * sorted by x, then y, so list order follows the canvas.
 * </p>
 */
@Slf4j
public class WorkflowFormatter {

    // Canvas grid of the workflow editor.
    static final int GRID_SIZE = 16;
    static final int NODE_WIDTH = GRID_SIZE * 6;
    static final int NODE_HEIGHT = GRID_SIZE * 6;
    static final int RANK_SEPARATION = GRID_SIZE * 8;
    static final int NODE_SEPARATION = GRID_SIZE * 6;
    static final int MARGIN_X = GRID_SIZE * 11;
    static final int MARGIN_Y = GRID_SIZE * 15;

    private final LayeredGraphLayout layout = new LayeredGraphLayout(
            NODE_WIDTH, NODE_HEIGHT, RANK_SEPARATION, NODE_SEPARATION, MARGIN_X, MARGIN_Y);

    public Workflow formatWorkflow(Workflow workflow) {
        Workflow formatted = workflow.copy();
        List<Node> nodes = formatted.getNodes();
        if (nodes.isEmpty()) {
            return formatted;
        }

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.putIfAbsent(nodes.get(i).getName(), i);
        }
        List<int[]> edges = new ArrayList<>();
        for (Connections.Edge edge : formatted.getConnections().edges()) {
            Integer from = index.get(edge.source());
            Integer to = index.get(edge.target());
            if (from != null && to != null) {
                edges.add(new int[]{from, to});
            }
        }

        LayeredGraphLayout.Result result = layout.layout(nodes.size(), edges);
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            node.setPosition(new Position(
                    Math.round(result.x()[i] - NODE_WIDTH / 2.0),
                    Math.round(result.y()[i] - NODE_HEIGHT / 2.0)));
            node.setParameters(JsonValues.stripNulls(node.getParameters()));
        }
        nodes.sort(Comparator.comparingDouble((Node n) -> n.getPosition().x())
                .thenComparingDouble(n -> n.getPosition().y()));
        log.debug("Formatted workflow id={} nodes={} edges={}", workflow.getId(), nodes.size(), edges.size());
        return formatted;
    }
}
