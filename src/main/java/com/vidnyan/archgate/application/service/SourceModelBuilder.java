package com.vidnyan.archgate.application.service;

import com.vidnyan.archgate.application.port.out.SourceTreeWalker;
import com.vidnyan.archgate.application.port.out.SyntaxAdapter;
import com.vidnyan.archgate.domain.graph.DependencyEdge;
import com.vidnyan.archgate.domain.graph.DependencyGraph;
import com.vidnyan.archgate.domain.graph.ReferenceResolver;
import com.vidnyan.archgate.domain.model.Classification;
import com.vidnyan.archgate.domain.model.RoleClassifier;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.model.StructuralSignals;
import com.vidnyan.archgate.domain.model.SyntaxExtraction;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds the frozen dependency graph of one code root and dialect.
 * <p>
 * Files are read, classified and extracted in parallel into per-file slots. Resolution starts
 * only after every slot is filled, then the graph is frozen. A file that cannot be read or
 * parsed still becomes a node, with no references and a parse-failure signal.
 * </p>
 */
@Slf4j
public class SourceModelBuilder {

    private final SyntaxAdapterRegistry registry;
    private final AdapterInvoker invoker;
    private final SourceTreeWalker walker;
    private final RoleClassifier classifier;
    private final int workerThreads;

    public SourceModelBuilder(SyntaxAdapterRegistry registry, AdapterInvoker invoker,
                              SourceTreeWalker walker, RoleClassifier classifier, int workerThreads) {
        this.registry = registry;
        this.invoker = invoker;
        this.walker = walker;
        this.classifier = classifier;
        this.workerThreads = workerThreads;
    }

    /**
     * Files under the root grouped by dialect, in dialect then path order.
     * Files no adapter claims are ignored.
     */
    public Map<String, List<Path>> partitionByDialect(Path codeRoot) throws IOException {
        Map<String, List<Path>> byDialect = new TreeMap<>();
        for (Path file : walker.listFiles(codeRoot)) {
            registry.forFile(file).ifPresent(adapter ->
                    byDialect.computeIfAbsent(adapter.dialectId(), k -> new ArrayList<>()).add(file));
        }
        return byDialect;
    }

    public DependencyGraph build(Path codeRoot, String dialect, List<Path> files) {
        SyntaxAdapter adapter = registry.forDialect(dialect)
                .orElseThrow(() -> new IllegalArgumentException("No adapter for dialect " + dialect));

        log.info("  Extracting {} {} files with {} workers", files.size(), dialect, workerThreads);
        List<Slot> slots = fillSlots(codeRoot, adapter, files);

        List<SourceFile> nodes = new ArrayList<>();
        for (Slot slot : slots) {
            if (slot.classification().isPresent()) {
                SyntaxExtraction extraction = slot.extraction();
                nodes.add(new SourceFile(nodes.size(), slot.relativePath(), dialect,
                        slot.classification().get(), extraction.references(), extraction.signals(),
                        extraction.restrictedCalls()));
            }
        }
        log.debug("  {} of {} files in scope", nodes.size(), slots.size());

        List<DependencyEdge> edges = new ReferenceResolver(nodes).resolveAll();
        return DependencyGraph.freeze(codeRoot.toString(), dialect, nodes, edges);
    }

    private List<Slot> fillSlots(Path codeRoot, SyntaxAdapter adapter, List<Path> files) {
        ExecutorService executor = Executors.newFixedThreadPool(workerThreads);
        try {
            List<Callable<Slot>> tasks = files.stream()
                    .sorted()
                    .<Callable<Slot>>map(file -> () -> extract(codeRoot, adapter, file))
                    .toList();
            List<Slot> slots = new ArrayList<>(tasks.size());
            for (Future<Slot> future : executor.invokeAll(tasks)) {
                slots.add(future.get());
            }
            return slots;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Source extraction interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Source extraction failed: " + e.getCause(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private Slot extract(Path codeRoot, SyntaxAdapter adapter, Path file) {
        String relativePath = codeRoot.relativize(file).toString().replace('\\', '/');
        Optional<Classification> classification = classifier.classify(relativePath);
        if (classification.isEmpty()) {
            return new Slot(relativePath, classification, new SyntaxExtraction(List.of(), StructuralSignals.empty()));
        }

        String text;
        try {
            text = readText(file);
        } catch (CharacterCodingException e) {
            log.warn("  Cannot decode {}: not valid UTF-8", relativePath);
            return new Slot(relativePath, classification, SyntaxExtraction.failed("not valid UTF-8 (" + e.getMessage() + ")"));
        } catch (IOException e) {
            log.warn("  Cannot read {}: {}", relativePath, e.getMessage());
            return new Slot(relativePath, classification, SyntaxExtraction.failed("unreadable: " + e.getMessage()));
        }

        SyntaxExtraction extraction = invoker.invoke(adapter, text,
                SyntaxAdapterRegistry.extensionOf(file), relativePath);
        if (extraction.signals().parseFailure()) {
            log.warn("  Parse failure in {}: {}", relativePath, extraction.signals().parseError());
        }
        return new Slot(relativePath, classification, extraction);
    }

    /**
     * Strict UTF-8, leading byte order mark removed.
     *
     * @throws CharacterCodingException when the file is not valid UTF-8
     */
    static String readText(Path file) throws IOException {
        String text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(Files.readAllBytes(file)))
                .toString();
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    private record Slot(String relativePath, Optional<Classification> classification, SyntaxExtraction extraction) {}
}
