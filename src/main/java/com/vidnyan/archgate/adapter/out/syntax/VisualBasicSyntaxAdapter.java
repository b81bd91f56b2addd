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
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Visual Basic .NET adapter. Line oriented: references are {@code Imports} statements and
 * feature layer class names used in code, bodies are the lines between {@code Sub}/{@code Function}
 * and their {@code End}.
 */
@Slf4j
@Component
public class VisualBasicSyntaxAdapter implements SyntaxAdapter {

    public static final String DIALECT = "vb";

    private static final Pattern IMPORTS = Pattern.compile(
            "^\\s*Imports\\s+(?:[A-Za-z_][A-Za-z0-9_]*\\s*=\\s*)?([A-Za-z_][A-Za-z0-9_.]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY_START = Pattern.compile(
            "^\\s*(?:(?:Public|Private|Protected|Friend|Shared|Overrides|Overridable|Async|Static|Overloads)\\s+)*"
                    + "(?:Sub|Function|Property)\\s+[A-Za-z_]", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY_END = Pattern.compile("^\\s*End\\s+(?:Sub|Function|Property)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TYPE_WITH_BODY = Pattern.compile(
            "^\\s*(?:(?:Public|Private|Friend|Partial|NotInheritable|MustInherit)\\s+)*(?:Class|Module|Structure)\\s+[A-Za-z_]",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BRANCH = Pattern.compile(
            "^\\s*(?:If|ElseIf|Select\\s+Case|Case|While|Do\\s+While|Do\\s+Until|For)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CALL = Pattern.compile("\\b([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");
    private static final Pattern CONDITION = Pattern.compile("^\\s*(?:If|ElseIf|While|Do\\s+While|Do\\s+Until|Select\\s+Case)\\s+(.*?)(?:\\s+Then)?\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MEMBER_ACCESS = Pattern.compile(
            "(?:\\b([A-Za-z_][A-Za-z0-9_]*))?\\.[A-Za-z_][A-Za-z0-9_]*\\b(?!\\s*\\()");
    private static final Set<String> NON_CALL_WORDS = Set.of(
            "if", "elseif", "while", "until", "case", "and", "or", "not", "andalso", "orelse", "sub", "function",
            "new", "ctype", "directcast", "trycast", "gettype", "return", "of", "in", "as");
    private static final Set<String> SELF_REFERENCES = Set.of("me", "mybase", "myclass");
    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "\\b(?:Class|Module|Structure|Interface|Enum)\\s+([A-Za-z_][A-Za-z0-9_]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAMESPACE = Pattern.compile("^\\s*Namespace\\b", Pattern.CASE_INSENSITIVE);

    private final LayerNameScanner layerNames = new LayerNameScanner(TYPE_DECLARATION, List.of(IMPORTS, NAMESPACE));

    @Override
    public String dialectId() {
        return DIALECT;
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of(".vb");
    }

    @Override
    public List<String> forbiddenIntentNamespaces() {
        return List.of("System.Windows.Forms", "System.Drawing", "Microsoft.Office.Interop", "System.IO.Ports", "System.IO");
    }

    @Override
    public SyntaxExtraction extract(String text, String dialectHint) {
        try {
            List<RawReference> references = new ArrayList<>();
            StructuralSignals.StructuralSignalsBuilder signals = StructuralSignals.builder();
            boolean implementation = false;
            boolean inBody = false;
            int codeLines = 0;
            int branches = 0;
            int calls = 0;
            int fieldAccesses = 0;
            int domainConditionals = 0;

            String[] lines = text.split("\r?\n", -1);
            List<String> codeView = new ArrayList<>(lines.length);
            for (String raw : lines) {
                codeView.add(blankStrings(stripComment(raw)));
            }
            for (int i = 0; i < lines.length; i++) {
                String line = stripComment(lines[i]);
                if (line.isBlank()) {
                    continue;
                }
                Matcher imports = IMPORTS.matcher(line);
                if (imports.find()) {
                    references.add(CSharpSyntaxAdapter.namespaceReference(imports.group(1), i + 1));
                    continue;
                }
                if (TYPE_WITH_BODY.matcher(line).find()) {
                    implementation = true;
                }
                if (BODY_END.matcher(line).find()) {
                    inBody = false;
                    continue;
                }
                if (BODY_START.matcher(line).find()) {
                    inBody = true;
                    continue;
                }
                if (!inBody) {
                    continue;
                }

                String code = blankStrings(line);
                codeLines++;
                if (BRANCH.matcher(code).find()) {
                    branches++;
                }
                calls += countCalls(code);
                Matcher condition = CONDITION.matcher(code);
                if (condition.find()) {
                    Matcher access = MEMBER_ACCESS.matcher(condition.group(1));
                    while (access.find()) {
                        String receiver = access.group(1);
                        if (receiver == null || !SELF_REFERENCES.contains(receiver.toLowerCase(Locale.ROOT))) {
                            fieldAccesses++;
                        }
                    }
                }
                if (BraceCodeScanner.DOMAIN_CONDITIONAL.matcher(code).find()) {
                    domainConditionals++;
                }
            }

            references.addAll(layerNames.scan(codeView));
            references.sort(Comparator.comparingInt(RawReference::line));
            return new SyntaxExtraction(references, signals
                    .implementation(implementation)
                    .codeLines(codeLines)
                    .branchCount(branches)
                    .callCount(calls)
                    .externalFieldAccessCount(fieldAccesses)
                    .domainConditionalCount(domainConditionals)
                    .build(), RestrictedCallScanner.scan(codeView));
        } catch (RuntimeException e) {
            log.debug("VB scan failed: {}", e.toString());
            return SyntaxExtraction.failed(e.toString());
        }
    }

    private static int countCalls(String code) {
        int count = 0;
        Matcher matcher = CALL.matcher(code);
        while (matcher.find()) {
            if (!NON_CALL_WORDS.contains(matcher.group(1).toLowerCase(Locale.ROOT))) {
                count++;
            }
        }
        return count;
    }

    /**
     * Drop an apostrophe or {@code REM} comment, ignoring apostrophes inside string literals.
     */
    static String stripComment(String line) {
        if (line.stripLeading().regionMatches(true, 0, "REM ", 0, 4) || line.strip().equalsIgnoreCase("REM")) {
            return "";
        }
        boolean inString = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (c == '\'' && !inString) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    private static String blankStrings(String line) {
        StringBuilder out = new StringBuilder(line.length());
        boolean inString = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inString = !inString;
                out.append(c);
            } else {
                out.append(inString ? ' ' : c);
            }
        }
        return out.toString();
    }
}
