package com.vidnyan.archgate.adapter.out.syntax;

import com.vidnyan.archgate.application.port.out.SyntaxAdapter;
import com.vidnyan.archgate.domain.model.RawReference;
import com.vidnyan.archgate.domain.model.StructuralSignals;
import com.vidnyan.archgate.domain.model.SyntaxExtraction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * C# adapter. References are {@code using} directives, including {@code using static} and aliases,
 * and feature layer class names used in code.
 */
@Slf4j
@Component
public class CSharpSyntaxAdapter implements SyntaxAdapter {

    public static final String DIALECT = "csharp";

    private static final Pattern USING = Pattern.compile(
            "^\\s*(?:global\\s+)?using\\s+(?:static\\s+)?(?:[A-Za-z_][A-Za-z0-9_]*\\s*=\\s*)?([A-Za-z_][A-Za-z0-9_.]*)\\s*;");
    private static final Pattern TYPE_WITH_BODY = Pattern.compile("\\b(?:class|struct|record)\\s+[A-Za-z_]");
    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "\\b(?:class|struct|record|interface|enum)\\s+([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern NAMESPACE = Pattern.compile("^\\s*namespace\\b");

    private final LayerNameScanner layerNames = new LayerNameScanner(TYPE_DECLARATION, List.of(USING, NAMESPACE));

    private final BraceCodeScanner scanner = new BraceCodeScanner(
            Set.of("if", "switch", "case", "while", "for", "foreach"),
            Set.of("return", "nameof", "typeof", "sizeof", "default", "using", "lock", "catch", "checked", "unchecked",
                    "base", "this", "when"),
            Set.of("this", "base"),
            false);

    @Override
    public String dialectId() {
        return DIALECT;
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of(".cs");
    }

    @Override
    public List<String> forbiddenIntentNamespaces() {
        return List.of("System.Windows.Forms", "System.Drawing", "Microsoft.Office.Interop", "System.IO.Ports", "System.IO");
    }

    @Override
    public SyntaxExtraction extract(String text, String dialectHint) {
        try {
            BraceCodeScanner.Scan scan = scanner.scan(text);
            if (scan.failed()) {
                return SyntaxExtraction.failed(scan.problem());
            }
            List<RawReference> references = new ArrayList<>();
            List<String> lines = scan.commentFreeLines();
            boolean implementation = false;
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                Matcher matcher = USING.matcher(line);
                if (matcher.find()) {
                    references.add(namespaceReference(matcher.group(1), i + 1));
                }
                if (TYPE_WITH_BODY.matcher(line).find()) {
                    implementation = true;
                }
            }
            StructuralSignals signals = StructuralSignals.builder()
                    .implementation(implementation)
                    .codeLines(scan.codeLines())
                    .branchCount(scan.branchCount())
                    .callCount(scan.callCount())
                    .externalFieldAccessCount(scan.externalFieldAccessCount())
                    .domainConditionalCount(scan.domainConditionalCount())
                    .build();
            references.addAll(layerNames.scan(scan.codeViewLines()));
            references.sort(Comparator.comparingInt(RawReference::line));
            return new SyntaxExtraction(references, signals, RestrictedCallScanner.scan(scan.codeViewLines()));
        } catch (RuntimeException e) {
            log.debug("C# scan failed: {}", e.toString());
            return SyntaxExtraction.failed(e.toString());
        }
    }

    /**
     * {@code Company.Svc.svc_uart} resolves by its last segment, with the dotted path as hint.
     */
    static RawReference namespaceReference(String namespace, int line) {
        String leaf = namespace.substring(namespace.lastIndexOf('.') + 1);
        return new RawReference(namespace, leaf, namespace.replace('.', '/'), line, false);
    }
}
