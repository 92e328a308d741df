package com.mainframe.flowgraph.parser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mainframe.flowgraph.model.input.BlockRecord;
import com.mainframe.flowgraph.model.input.ProgramMetadata;
import com.mainframe.flowgraph.model.input.StepRecord;

/**
 * Maps source-parser JSON documents onto typed records.
 *
 * COBOL paragraph document:
 * <pre>
 * { "program_id": "PGM1",
 *   "identification_division": {...}, "environment_division": {...}, "data_division": {...},
 *   "procedure_division": {
 *     "using": ["WS-PARM"],
 *     "paragraph": { "paragraph_name": "ENTRY", "paragraph_order": 1,
 *                    "code_with_comments": "...", "code_without_comments": "...",
 *                    "perform_targets": [...], "goto_targets": [...], "called_programs": [...] } } }
 * </pre>
 *
 * JCL step document:
 * <pre>
 * { "jobName": "JOB1",
 *   "step": { "stepName": "S1", "stepNumber": 1, "programId": "PGM1", "datasets": [...],
 *             "codeWithComments": "...", "codeWithoutComments": "..." } }
 * </pre>
 *
 * Missing values become {@code null} (identifiers) or empty containers; the
 * graph builders decide what is required.
 */
public class RecordJsonParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public RecordJsonParser() {
        this(new ObjectMapper());
    }

    public RecordJsonParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonNode readTree(String json) throws IOException {
        return mapper.readTree(json);
    }

    public BlockRecord parseBlock(String json) throws IOException {
        return parseBlock(mapper.readTree(json));
    }

    public StepRecord parseStep(String json) throws IOException {
        return parseStep(mapper.readTree(json));
    }

    public BlockRecord parseBlock(JsonNode doc) {
        JsonNode procedure = doc.path("procedure_division");
        JsonNode paragraph = procedure.path("paragraph");

        ProgramMetadata metadata = ProgramMetadata.builder()
                .identificationDivision(objectAsMap(doc.path("identification_division")))
                .environmentDivision(objectAsMap(doc.path("environment_division")))
                .dataDivision(objectAsMap(doc.path("data_division")))
                .procedureDivisionUsing(textList(procedure.path("using")))
                .build();

        return BlockRecord.builder()
                .ownerId(text(doc.path("program_id")))
                .blockName(text(paragraph.path("paragraph_name")))
                .order(integer(paragraph.path("paragraph_order")))
                .codeWithComments(textOrEmpty(paragraph.path("code_with_comments")))
                .codeWithoutComments(textOrEmpty(paragraph.path("code_without_comments")))
                .performTargets(textList(paragraph.path("perform_targets")))
                .gotoTargets(textList(paragraph.path("goto_targets")))
                .calledUnits(textSet(paragraph.path("called_programs")))
                .metadata(metadata)
                .build();
    }

    public StepRecord parseStep(JsonNode doc) {
        JsonNode step = doc.path("step");

        List<Object> datasets = step.path("datasets").isArray()
                ? mapper.convertValue(step.path("datasets"), LIST_TYPE)
                : List.of();

        return StepRecord.builder()
                .jobName(text(doc.path("jobName")))
                .stepName(text(step.path("stepName")))
                .stepNumber(integer(step.path("stepNumber")))
                .targetUnitId(text(step.path("programId")))
                .datasets(datasets)
                .codeWithComments(textOrEmpty(step.path("codeWithComments")))
                .codeWithoutComments(textOrEmpty(step.path("codeWithoutComments")))
                .build();
    }

    private Map<String, Object> objectAsMap(JsonNode node) {
        if (!node.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    private static String text(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static String textOrEmpty(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : "";
    }

    private static Integer integer(JsonNode node) {
        if (node.isNumber()) {
            return node.isIntegralNumber() && node.canConvertToInt() ? node.intValue() : null;
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Accepts an array of strings or a single string.
     */
    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = text(item);
                if (value != null) {
                    values.add(value);
                }
            }
        } else {
            String value = text(node);
            if (value != null) {
                values.add(value);
            }
        }
        return List.copyOf(values);
    }

    private static Set<String> textSet(JsonNode node) {
        return Set.copyOf(new LinkedHashSet<>(textList(node)));
    }
}
