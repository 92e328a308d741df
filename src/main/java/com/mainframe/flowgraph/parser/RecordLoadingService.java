package com.mainframe.flowgraph.parser;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.mainframe.flowgraph.model.core.context.DiagnosticKind;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.input.BlockRecord;
import com.mainframe.flowgraph.model.input.StepRecord;

import lombok.RequiredArgsConstructor;

/**
 * Loads parser output from an input directory laid out as:
 * <pre>
 * input/
 *   jcl/*.json          one step document (or an array of them) per file
 *   cobol/PGM1/*.json   one paragraph document (or an array of them) per file
 * </pre>
 * Files are read in path order. A file that cannot be read or decoded is
 * reported and skipped; the rest of the batch is still loaded.
 */
@RequiredArgsConstructor
public class RecordLoadingService {
    private static final Logger log = LoggerFactory.getLogger(RecordLoadingService.class);

    public static final String JCL_DIR = "jcl";
    public static final String COBOL_DIR = "cobol";
    private static final String JSON_GLOB = "*.json";

    private final RecordJsonParser parser;

    public LoadedRecords loadAll(Path inputDir, GraphDiagnostics diagnostics) throws IOException {
        List<StepRecord> steps = new ArrayList<>();
        List<BlockRecord> blocks = new ArrayList<>();
        int filesRead = 0;

        Path jclDir = inputDir.resolve(JCL_DIR);
        if (Files.isDirectory(jclDir)) {
            for (Path file : listJsonFiles(jclDir)) {
                if (readDocuments(file, doc -> steps.add(parser.parseStep(doc)), diagnostics)) {
                    filesRead++;
                }
            }
        } else {
            log.warn("No JCL directory found at {}", jclDir);
        }

        Path cobolDir = inputDir.resolve(COBOL_DIR);
        if (Files.isDirectory(cobolDir)) {
            for (Path programDir : listSubdirectories(cobolDir)) {
                for (Path file : listJsonFiles(programDir)) {
                    if (readDocuments(file, doc -> blocks.add(parser.parseBlock(doc)), diagnostics)) {
                        filesRead++;
                    }
                }
            }
        } else {
            log.warn("No COBOL directory found at {}", cobolDir);
        }

        log.info("Loaded {} JCL step records and {} COBOL block records from {} files",
                steps.size(), blocks.size(), filesRead);
        return new LoadedRecords(List.copyOf(blocks), List.copyOf(steps), filesRead);
    }

    private boolean readDocuments(Path file, Consumer<JsonNode> sink, GraphDiagnostics diagnostics) {
        JsonNode root;
        try {
            root = parser.readTree(Files.readString(file));
        } catch (IOException e) {
            log.error("Error reading JSON from {}: {}", file, e.getMessage());
            diagnostics.add(DiagnosticKind.INPUT_ERROR, file.toString(), "Unreadable JSON: " + e.getMessage());
            return false;
        }

        if (root == null || root.isMissingNode()) {
            log.warn("Empty JSON document in {}", file);
            diagnostics.add(DiagnosticKind.INPUT_ERROR, file.toString(), "Empty document");
            return false;
        }
        if (root.isArray()) {
            root.forEach(sink);
        } else if (root.isObject()) {
            sink.accept(root);
        } else {
            log.warn("Ignoring {}: top-level value is neither an object nor an array", file);
            diagnostics.add(DiagnosticKind.INPUT_ERROR, file.toString(), "Top-level value is not an object or array");
            return false;
        }
        return true;
    }

    private List<Path> listJsonFiles(Path dir) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, JSON_GLOB)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    files.add(p);
                }
            }
        }
        files.sort(null);
        return files;
    }

    private List<Path> listSubdirectories(Path dir) throws IOException {
        List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isDirectory)) {
            stream.forEach(dirs::add);
        }
        dirs.sort(null);
        return dirs;
    }
}
