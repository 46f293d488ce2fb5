package com.example.workflowguard.api.v1;

import com.example.workflowguard.api.v1.dto.NodeTypeListResponse;
import com.example.workflowguard.registry.NodeTypeEntry;
import com.example.workflowguard.registry.NodeTypeRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for searching the node type catalogue.
 */
@RestController
@RequestMapping("/api/v1/node-types")
@RequiredArgsConstructor
@Slf4j
public class NodeTypesController {

    private final NodeTypeRegistry registry;

    @GetMapping
    public NodeTypeListResponse list(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Integer limit) {
        List<NodeTypeEntry> nodes = registry.search(search, category, limit);
        log.debug("Listing node types search={} category={} count={}", search, category, nodes.size());
        return new NodeTypeListResponse(nodes, nodes.size(), registry.count(), registry.categories());
    }
}
