package com.mainframe.flowgraph.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mainframe.flowgraph.graph.FlowGraphResult;
import com.mainframe.flowgraph.graph.inner.EliminationReport;
import com.mainframe.flowgraph.graph.traversal.TraversalOrder;
import com.mainframe.flowgraph.graph.traversal.TraversalProvider;
import com.mainframe.flowgraph.model.graph.BlockNode;
import com.mainframe.flowgraph.model.graph.Edge;
import com.mainframe.flowgraph.model.graph.FlowGraph;
import com.mainframe.flowgraph.model.graph.InnerGraph;
import com.mainframe.flowgraph.model.graph.JobNode;
import com.mainframe.flowgraph.model.graph.OuterNode;
import com.mainframe.flowgraph.model.graph.OuterNodeVisitor;
import com.mainframe.flowgraph.model.graph.ProgramNode;
import com.mainframe.flowgraph.model.graph.StepNode;

/**
 * Writes a finished build as a single JSON document for downstream consumers.
 *
 * Layout:
 * <pre>
 * { "schema": "legacy-flowgraph/v1",
 *   "outer": { "nodes": [...], "edges": [...], "topological": true, "forward": [...], "reverse": [...] },
 *   "programs": { "PGM1": { "nodes": [...], "edges": [...], "forward": [...], "reverse": [...],
 *                           "removedBlocks": [...], "removedEdges": [...] } },
 *   "diagnostics": [...] }
 * </pre>
 * Map keys keep insertion order so identical builds produce identical files.
 */
public final class GraphJsonExporter {
    private static final Logger log = LoggerFactory.getLogger(GraphJsonExporter.class);

    public static final String SCHEMA_VERSION = "legacy-flowgraph/v1";

    private final ObjectMapper mapper;
    private final TraversalProvider traversal;

    public GraphJsonExporter(TraversalProvider traversal) {
        this.traversal = Objects.requireNonNull(traversal, "traversal");
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(FlowGraphResult result, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(result), StandardCharsets.UTF_8);
        log.info("Graphs written to {}", file.toAbsolutePath());
    }

    public String toJson(FlowGraphResult result) throws IOException {
        return mapper.writeValueAsString(toDocument(result));
    }

    Map<String, Object> toDocument(FlowGraphResult result) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("schema", SCHEMA_VERSION);

        TraversalOrder<OuterNode> outerOrder = traversal.outerOrder(result.getOuterGraph());
        Map<String, Object> outer = new LinkedHashMap<>();
        List<Map<String, Object>> outerNodes = new ArrayList<>();
        for (OuterNode node : result.getOuterGraph().getNodes()) {
            outerNodes.add(node.accept(NODE_WRITER));
        }
        outer.put("nodes", outerNodes);
        outer.put("edges", edges(result.getOuterGraph()));
        outer.put("topological", outerOrder.isTopological());
        outer.put("forward", outerOrder.forwardIds());
        outer.put("reverse", outerOrder.reverseIds());
        doc.put("outer", outer);

        Map<String, Object> programs = new LinkedHashMap<>();
        for (Map.Entry<String, InnerGraph> entry : result.getInnerGraphs().entrySet()) {
            programs.put(entry.getKey(), innerDocument(entry.getValue(),
                    result.getEliminationReports().get(entry.getKey())));
        }
        doc.put("programs", programs);

        doc.put("diagnostics", result.getDiagnostics().getEntries().stream()
                .map(d -> Map.of("kind", d.getKind().name(), "subject", d.getSubject(), "message", d.getMessage()))
                .toList());
        return doc;
    }

    private Map<String, Object> innerDocument(InnerGraph graph, EliminationReport report) {
        TraversalOrder<BlockNode> order = traversal.innerOrder(graph);
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("entry", graph.getEntryId());
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (BlockNode block : graph.getNodes()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("id", block.getId());
            node.put("name", block.getName());
            node.put("order", block.getOrder());
            node.put("codeWithComments", block.getCodeWithComments());
            node.put("codeWithoutComments", block.getCodeWithoutComments());
            nodes.add(node);
        }
        doc.put("nodes", nodes);
        doc.put("edges", edges(graph));
        doc.put("forward", order.forwardIds());
        doc.put("reverse", order.reverseIds());
        if (report != null) {
            doc.put("entryPresent", report.isEntryPresent());
            doc.put("removedBlocks", report.getRemovedBlocks());
            doc.put("removedEdges", report.getRemovedEdges().stream().map(GraphJsonExporter::edge).toList());
        }
        return doc;
    }

    private static List<Map<String, Object>> edges(FlowGraph<?> graph) {
        return graph.getEdges().stream().map(GraphJsonExporter::edge).toList();
    }

    private static Map<String, Object> edge(Edge edge) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("source", edge.getSource());
        json.put("target", edge.getTarget());
        json.put("type", edge.getType().name());
        return json;
    }

    private static final OuterNodeVisitor<Map<String, Object>> NODE_WRITER = new OuterNodeVisitor<>() {
        @Override
        public Map<String, Object> visitJob(JobNode job) {
            Map<String, Object> node = header(job);
            node.put("jobName", job.getJobName());
            return node;
        }

        @Override
        public Map<String, Object> visitStep(StepNode step) {
            Map<String, Object> node = header(step);
            node.put("jobName", step.getJobName());
            node.put("stepName", step.getStepName());
            node.put("stepNumber", step.getStepNumber());
            node.put("programId", step.getTargetUnitId());
            node.put("datasets", step.getDatasets());
            node.put("codeWithComments", step.getCodeWithComments());
            node.put("codeWithoutComments", step.getCodeWithoutComments());
            return node;
        }

        @Override
        public Map<String, Object> visitProgram(ProgramNode program) {
            Map<String, Object> node = header(program);
            node.put("placeholder", program.isPlaceholder());
            node.put("hasInnerGraph", program.hasInnerGraph());
            node.put("identificationDivision", program.getMetadata().getIdentificationDivision());
            node.put("environmentDivision", program.getMetadata().getEnvironmentDivision());
            node.put("dataDivision", program.getMetadata().getDataDivision());
            node.put("procedureDivisionUsing", program.getMetadata().getProcedureDivisionUsing());
            node.put("codeWithComments", program.getCodeWithComments());
            node.put("codeWithoutComments", program.getCodeWithoutComments());
            return node;
        }

        private Map<String, Object> header(OuterNode outerNode) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("id", outerNode.getId());
            node.put("kind", outerNode.getKind().name());
            return node;
        }
    };
}
