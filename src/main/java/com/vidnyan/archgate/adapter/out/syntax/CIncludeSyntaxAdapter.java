package com.vidnyan.archgate.adapter.out.syntax;

import com.vidnyan.archgate.application.port.out.SyntaxAdapter;
import com.vidnyan.archgate.domain.model.RawReference;
import com.vidnyan.archgate.domain.model.StructuralSignals;
import com.vidnyan.archgate.domain.model.SyntaxExtraction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * C and C++ adapter. References are {@code #include} directives; {@code <...>} includes are system references.
 */
@Slf4j
@Component
public class CIncludeSyntaxAdapter implements SyntaxAdapter {

    public static final String DIALECT = "c";

    private static final Pattern INCLUDE = Pattern.compile("^\\s*#\\s*include\\s*([<\"])([^\">]+)[\">]");
    private static final Set<String> IMPLEMENTATION_EXTENSIONS = Set.of(".c", ".cpp");

    private final BraceCodeScanner scanner = new BraceCodeScanner(
            Set.of("if", "switch", "case", "while", "for"),
            Set.of("sizeof", "return", "defined", "alignof", "typeof", "static_assert", "_Static_assert", "__attribute__"),
            Set.of("this"),
            true);

    @Override
    public String dialectId() {
        return DIALECT;
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of(".c", ".h", ".cpp", ".hpp");
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
            for (int i = 0; i < lines.size(); i++) {
                Matcher matcher = INCLUDE.matcher(lines.get(i));
                if (matcher.find()) {
                    String path = matcher.group(2).strip();
                    references.add(RawReference.of(path, path, i + 1, "<".equals(matcher.group(1))));
                }
            }
            StructuralSignals signals = StructuralSignals.builder()
                    .implementation(IMPLEMENTATION_EXTENSIONS.contains(dialectHint))
                    .codeLines(scan.codeLines())
                    .branchCount(scan.branchCount())
                    .callCount(scan.callCount())
                    .externalFieldAccessCount(scan.externalFieldAccessCount())
                    .domainConditionalCount(scan.domainConditionalCount())
                    .build();
            return new SyntaxExtraction(references, signals);
        } catch (RuntimeException e) {
            log.debug("C scan failed: {}", e.toString());
            return SyntaxExtraction.failed(e.toString());
        }
    }
}
