package com.hcltech.causal.graph;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.causal.common.codec.Codec;
import com.hcltech.causal.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads user-authored graphs of the form
 * {@code {"id": "g", "nodes": [{"id": "X", "name": "X"}], "edges": [{"from": "X", "to": "Y", "kind": "directed"}]}}.
 * Unknown properties (layout positions, weights, ...) are ignored. Never throws: every problem is an error entry.
 */
public interface CausalGraphLoader {

    record NodeDocument(String id, String name, String type, Map<String, Object> metadata) {}

    record EdgeDocument(String from, String to, String kind) {}

    record GraphDocument(String id, List<NodeDocument> nodes, List<EdgeDocument> edges, Map<String, Object> metadata) {}

    Logger LOG = LoggerFactory.getLogger(CausalGraphLoader.class);

    ObjectMapper JSON = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    Codec<GraphDocument, String> DOCUMENT_CODEC = Codec.clazzCodec(JSON, GraphDocument.class);
    Codec<CausalGraph, String> GRAPH_CODEC = Codec.clazzCodec(JSON, CausalGraph.class);

    static ErrorsOr<CausalGraph> fromJson(String json) {
        return DOCUMENT_CODEC.decode(json).flatMap(CausalGraphLoader::toGraph);
    }

    static ErrorsOr<CausalGraph> fromJson(InputStream in) {
        return ErrorsOr.trying(() -> new String(in.readAllBytes(), StandardCharsets.UTF_8))
                .flatMap(CausalGraphLoader::fromJson);
    }

    /** Load from a classpath resource using the thread context ClassLoader, falling back to this class's loader. */
    static ErrorsOr<CausalGraph> fromClasspath(String resourcePath) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        InputStream in = cl == null ? null : cl.getResourceAsStream(resourcePath);
        if (in == null) in = CausalGraphLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (in == null) return ErrorsOr.error("Classpath resource not found: " + resourcePath);
        try (InputStream autoClose = in) {
            return fromJson(autoClose).addPrefixIfError("graph '" + resourcePath + "': ");
        } catch (Exception e) {
            return ErrorsOr.error("Failed to close classpath resource " + resourcePath + ": {0}: {1}", e);
        }
    }

    static ErrorsOr<String> toJson(CausalGraph graph) {
        return GRAPH_CODEC.encode(graph);
    }

    private static ErrorsOr<CausalGraph> toGraph(GraphDocument doc) {
        List<String> errs = new ArrayList<>();
        if (doc.id() == null || doc.id().isBlank()) errs.add("graph id must be non-empty");

        List<Node> nodes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<NodeDocument> nodeDocs = doc.nodes() == null ? List.of() : doc.nodes();
        for (int i = 0; i < nodeDocs.size(); i++) {
            NodeDocument n = nodeDocs.get(i);
            if (n == null || n.id() == null || n.id().isBlank()) {
                errs.add("nodes[" + i + "]: id must be non-empty");
                continue;
            }
            if (!seen.add(n.id())) errs.add("nodes[" + i + "]: duplicate node id " + n.id());
            try {
                nodes.add(new Node(n.id(), n.name(), NodeType.parse(n.type()), n.metadata()));
            } catch (IllegalArgumentException e) {
                errs.add("nodes[" + i + "]: unknown node type " + n.type());
            }
        }

        List<Edge> edges = new ArrayList<>();
        List<EdgeDocument> edgeDocs = doc.edges() == null ? List.of() : doc.edges();
        for (int i = 0; i < edgeDocs.size(); i++) {
            EdgeDocument e = edgeDocs.get(i);
            if (e == null || e.from() == null || e.from().isBlank() || e.to() == null || e.to().isBlank()) {
                errs.add("edges[" + i + "]: from and to must be non-empty");
                continue;
            }
            try {
                edges.add(new Edge(e.from(), e.to(), EdgeKind.parse(e.kind())));
            } catch (IllegalArgumentException ex) {
                errs.add("edges[" + i + "]: unknown edge kind " + e.kind());
                continue;
            }
            if (!seen.contains(e.from()) || !seen.contains(e.to()))
                LOG.warn("Graph {}: edge {} -> {} names an unknown node and will be ignored by analysis", doc.id(), e.from(), e.to());
        }

        if (!errs.isEmpty()) return ErrorsOr.errors(errs);
        return ErrorsOr.lift(new CausalGraph(doc.id(), nodes, edges, doc.metadata()));
    }
}
