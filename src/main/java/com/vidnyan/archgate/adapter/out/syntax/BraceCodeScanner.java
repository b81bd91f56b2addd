package com.vidnyan.archgate.adapter.out.syntax;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical scanner for brace-delimited languages (C family, C#).
 * <p>
 * Strips comments and string contents, tracks brace depth and counts the structural
 * signals inside bodies (depth above zero). Purely textual: no grammar, no types.
 * </p>
 */
final class BraceCodeScanner {

    static final Pattern DOMAIN_CONDITIONAL = Pattern.compile(
            "\\b(?:if|switch|case)\\b.*\\b(?:mode|state|status|level|type|flag|enable|disable|active|threshold)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern IDENTIFIER_CALL = Pattern.compile("\\b([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");
    private static final Pattern CONDITION_KEYWORD = Pattern.compile("\\b(?:if|while|switch)\\s*\\(");
    private static final Pattern MEMBER_ACCESS = Pattern.compile(
            "(?:([A-Za-z_][A-Za-z0-9_]*)\\s*)?(?:->|\\.)\\s*[A-Za-z_][A-Za-z0-9_]*\\b(?!\\s*\\()");

    private static final Set<String> CALL_PRECEDING_WORDS = Set.of(
            "return", "new", "await", "else", "case", "throw", "yield", "in", "is", "not", "and", "or");

    private final Set<String> branchKeywords;
    private final Set<String> nonCallKeywords;
    private final Set<String> selfReferences;
    private final boolean ternaryIsBranch;
    private final Pattern branchPattern;

    BraceCodeScanner(Set<String> branchKeywords, Set<String> nonCallKeywords,
                     Set<String> selfReferences, boolean ternaryIsBranch) {
        this.branchKeywords = branchKeywords;
        this.nonCallKeywords = nonCallKeywords;
        this.selfReferences = selfReferences;
        this.ternaryIsBranch = ternaryIsBranch;
        this.branchPattern = Pattern.compile("\\b(?:" + String.join("|", branchKeywords) + ")\\b");
    }

    /**
     * Scan one file. Unterminated comments or literals and unbalanced braces yield a failed scan.
     */
    Scan scan(String text) {
        Stripped stripped = strip(text);
        if (stripped.problem() != null) {
            return Scan.failed(stripped.problem());
        }
        String[] codeLines = stripped.code().split("\n", -1);

        int depth = 0;
        int lines = 0;
        int branches = 0;
        int calls = 0;
        int fieldAccesses = 0;
        int domainConditionals = 0;

        for (int number = 1; number <= codeLines.length; number++) {
            String line = codeLines[number - 1];
            if (line.strip().startsWith("#")) {
                continue;
            }
            StringBuilder body = new StringBuilder();
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    if (depth == 0) {
                        return Scan.failed("unmatched '}' at line " + number);
                    }
                    depth--;
                }
                body.append(depth > 0 ? c : ' ');
            }
            String trimmed = body.toString().strip();
            if (trimmed.isEmpty() || isBraceOnly(trimmed)) {
                continue;
            }
            lines++;
            branches += countBranches(trimmed);
            calls += countCalls(trimmed);
            fieldAccesses += countConditionFieldAccesses(trimmed);
            if (DOMAIN_CONDITIONAL.matcher(trimmed).find()) {
                domainConditionals++;
            }
        }

        if (depth > 0) {
            return Scan.failed("unbalanced braces: " + depth + " '{' not closed at end of file");
        }
        return new Scan(List.of(stripped.commentFree().split("\n", -1)), List.of(codeLines),
                lines, branches, calls, fieldAccesses, domainConditionals, null);
    }

    private static boolean isBraceOnly(String trimmed) {
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c != '{' && c != '}' && c != ';' && !Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    int countBranches(String line) {
        int count = 0;
        Matcher matcher = branchPattern.matcher(line);
        while (matcher.find()) {
            count++;
        }
        if (ternaryIsBranch) {
            for (int i = 0; i < line.length(); i++) {
                if (line.charAt(i) == '?') {
                    count++;
                }
            }
        }
        return count;
    }

    int countCalls(String line) {
        int count = 0;
        Matcher matcher = IDENTIFIER_CALL.matcher(line);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (nonCallKeywords.contains(name) || branchKeywords.contains(name)) {
                continue;
            }
            if (isCallPosition(line, matcher.start(1))) {
                count++;
            }
        }
        return count;
    }

    /**
     * A call, not a declaration: the identifier is not preceded by a type name.
     */
    private static boolean isCallPosition(String line, int start) {
        int i = start - 1;
        while (i >= 0 && Character.isWhitespace(line.charAt(i))) {
            i--;
        }
        if (i < 0) {
            return true;
        }
        char previous = line.charAt(i);
        if (Character.isLetterOrDigit(previous) || previous == '_') {
            int end = i + 1;
            while (i >= 0 && (Character.isLetterOrDigit(line.charAt(i)) || line.charAt(i) == '_')) {
                i--;
            }
            return CALL_PRECEDING_WORDS.contains(line.substring(i + 1, end));
        }
        if (previous == '>') {
            return i > 0 && line.charAt(i - 1) == '-';
        }
        return previous != '*' && previous != ']';
    }

    int countConditionFieldAccesses(String line) {
        int count = 0;
        Matcher keyword = CONDITION_KEYWORD.matcher(line);
        while (keyword.find()) {
            String condition = balancedParentheses(line, keyword.end() - 1);
            Matcher access = MEMBER_ACCESS.matcher(condition);
            while (access.find()) {
                String receiver = access.group(1);
                if (receiver == null || !selfReferences.contains(receiver)) {
                    count++;
                }
            }
        }
        return count;
    }

    private static String balancedParentheses(String line, int open) {
        int depth = 0;
        for (int i = open; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return line.substring(open + 1, i);
                }
            }
        }
        return line.substring(open + 1);
    }

    /**
     * Blank out comments (keeping line breaks) and, for the code view, string and char contents.
     * Verbatim strings ({@code @"..."}) may span lines; other literals end at the line break.
     */
    static Stripped strip(String text) {
        StringBuilder commentFree = new StringBuilder(text.length());
        StringBuilder code = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();
        int line = 1;
        boolean directive = false;
        boolean lineStart = true;
        while (i < n) {
            char c = text.charAt(i);
            char next = i + 1 < n ? text.charAt(i + 1) : '\0';
            if (c == '\n') {
                line++;
                directive = false;
                lineStart = true;
                commentFree.append(c);
                code.append(c);
                i++;
                continue;
            }
            if (lineStart && !Character.isWhitespace(c)) {
                directive = c == '#';
                lineStart = false;
            }
            if (c == '/' && next == '/') {
                while (i < n && text.charAt(i) != '\n') {
                    commentFree.append(' ');
                    code.append(' ');
                    i++;
                }
            } else if (c == '/' && next == '*') {
                int end = text.indexOf("*/", i + 2);
                if (end < 0) {
                    return Stripped.failed("unterminated block comment starting at line " + line);
                }
                for (; i < end + 2; i++) {
                    boolean newline = text.charAt(i) == '\n';
                    if (newline) {
                        line++;
                    }
                    char blank = newline ? '\n' : ' ';
                    commentFree.append(blank);
                    code.append(blank);
                }
            } else if (c == '"' && i > 0 && text.charAt(i - 1) == '@') {
                int startLine = line;
                commentFree.append(c);
                code.append(c);
                i++;
                boolean closed = false;
                while (i < n) {
                    char inner = text.charAt(i);
                    if (inner == '"' && i + 1 < n && text.charAt(i + 1) == '"') {
                        commentFree.append("\"\"");
                        code.append("  ");
                        i += 2;
                        continue;
                    }
                    if (inner == '"') {
                        closed = true;
                        break;
                    }
                    if (inner == '\n') {
                        line++;
                    }
                    commentFree.append(inner);
                    code.append(inner == '\n' ? '\n' : ' ');
                    i++;
                }
                if (!closed) {
                    return Stripped.failed("unterminated verbatim string starting at line " + startLine);
                }
                commentFree.append(c);
                code.append(c);
                i++;
            } else if (c == '"' || (c == '\'' && !isDigitSeparator(text, i))) {
                commentFree.append(c);
                code.append(c);
                i++;
                while (i < n && text.charAt(i) != c && text.charAt(i) != '\n') {
                    char inner = text.charAt(i);
                    if (inner == '\\' && i + 1 < n) {
                        char escaped = text.charAt(i + 1);
                        if (escaped == '\n') {
                            line++;
                        }
                        commentFree.append(inner).append(escaped);
                        code.append(' ').append(escaped == '\n' ? '\n' : ' ');
                        i += 2;
                        continue;
                    }
                    commentFree.append(inner);
                    code.append(' ');
                    i++;
                }
                if (i < n && text.charAt(i) == c) {
                    commentFree.append(c);
                    code.append(c);
                    i++;
                } else if (!directive) {
                    return Stripped.failed("unterminated " + (c == '"' ? "string" : "character")
                            + " literal at line " + line);
                }
            } else {
                char kept = c == '\r' ? ' ' : c;
                commentFree.append(kept);
                code.append(kept);
                i++;
            }
        }
        return new Stripped(commentFree.toString(), code.toString(), null);
    }

    // 1'000'000 in C++14 and later: the apostrophe sits inside a numeric token.
    private static boolean isDigitSeparator(String text, int i) {
        if (i + 1 >= text.length() || !Character.isLetterOrDigit(text.charAt(i + 1))) {
            return false;
        }
        int start = i;
        while (start > 0 && (Character.isLetterOrDigit(text.charAt(start - 1))
                || text.charAt(start - 1) == '_' || text.charAt(start - 1) == '\'')) {
            start--;
        }
        return start < i && Character.isDigit(text.charAt(start));
    }

    /**
     * @param problem why the text is not well-formed, or null
     */
    record Stripped(String commentFree, String code, String problem) {

        static Stripped failed(String problem) {
            return new Stripped("", "", problem);
        }
    }

    /**
     * @param commentFreeLines source lines with comments blanked, strings intact
     * @param codeViewLines    source lines with comments and string contents blanked
     * @param problem          why the file could not be scanned, or null
     */
    record Scan(
        List<String> commentFreeLines,
        List<String> codeViewLines,
        int codeLines,
        int branchCount,
        int callCount,
        int externalFieldAccessCount,
        int domainConditionalCount,
        String problem
    ) {
        Scan {
            commentFreeLines = List.copyOf(commentFreeLines);
            codeViewLines = List.copyOf(codeViewLines);
        }

        static Scan failed(String problem) {
            return new Scan(List.of(), List.of(), 0, 0, 0, 0, 0, problem);
        }

        boolean failed() {
            return problem != null;
        }
    }
}
