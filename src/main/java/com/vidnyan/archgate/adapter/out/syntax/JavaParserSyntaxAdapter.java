package com.vidnyan.archgate.adapter.out.syntax;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.vidnyan.archgate.application.port.out.SyntaxAdapter;
import com.vidnyan.archgate.domain.model.RawReference;
import com.vidnyan.archgate.domain.model.StructuralSignals;
import com.vidnyan.archgate.domain.model.SyntaxExtraction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * JavaParser-based adapter for Java sources. References are import declarations.
 */
@Slf4j
@Component
public class JavaParserSyntaxAdapter implements SyntaxAdapter {

    public static final String DIALECT = "java";

    private static final Pattern DOMAIN_WORD = Pattern.compile(
            "\\b(?:mode|state|status|level|type|flag|enable|disable|active|threshold)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String dialectId() {
        return DIALECT;
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of(".java");
    }

    @Override
    public List<String> forbiddenIntentNamespaces() {
        return List.of("java.io", "java.nio.file", "java.net", "javax.swing", "java.awt");
    }

    @Override
    public SyntaxExtraction extract(String text, String dialectHint) {
        // JavaParser instances are not thread-safe
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        try {
            ParseResult<CompilationUnit> result = parser.parse(text);
            if (!result.isSuccessful() || result.getResult().isEmpty()) {
                String problem = result.getProblems().isEmpty()
                        ? "unparsable Java source"
                        : result.getProblems().get(0).getVerboseMessage();
                return SyntaxExtraction.failed(problem);
            }
            CompilationUnit cu = result.getResult().get();
            return new SyntaxExtraction(extractImports(cu), extractSignals(cu));
        } catch (RuntimeException e) {
            log.debug("Java parse failed: {}", e.toString());
            return SyntaxExtraction.failed(e.toString());
        }
    }

    private List<RawReference> extractImports(CompilationUnit cu) {
        List<RawReference> references = new ArrayList<>();
        for (ImportDeclaration imported : cu.getImports()) {
            String name = imported.getNameAsString();
            String raw = imported.isAsterisk() ? name + ".*" : name;
            String type;
            if (imported.isStatic()) {
                type = imported.isAsterisk() ? name : name.substring(0, Math.max(name.lastIndexOf('.'), 0));
            } else {
                type = imported.isAsterisk() ? name + ".*" : name;
            }
            String leaf = type.substring(type.lastIndexOf('.') + 1);
            int line = imported.getBegin().map(position -> position.line).orElse(0);
            references.add(new RawReference(raw, leaf, type.replace('.', '/'), line, false));
        }
        return references;
    }

    private StructuralSignals extractSignals(CompilationUnit cu) {
        int branches = cu.findAll(IfStmt.class).size()
                + cu.findAll(SwitchStmt.class).size()
                + cu.findAll(SwitchExpr.class).size()
                + (int) cu.findAll(SwitchEntry.class).stream().filter(entry -> !entry.getLabels().isEmpty()).count()
                + cu.findAll(WhileStmt.class).size()
                + cu.findAll(DoStmt.class).size()
                + cu.findAll(ForStmt.class).size()
                + cu.findAll(ForEachStmt.class).size()
                + cu.findAll(ConditionalExpr.class).size();

        List<Expression> conditions = new ArrayList<>();
        cu.findAll(IfStmt.class).forEach(stmt -> conditions.add(stmt.getCondition()));
        cu.findAll(WhileStmt.class).forEach(stmt -> conditions.add(stmt.getCondition()));
        cu.findAll(SwitchStmt.class).forEach(stmt -> conditions.add(stmt.getSelector()));

        int fieldAccesses = 0;
        int domainConditionals = 0;
        for (Expression condition : conditions) {
            fieldAccesses += (int) fieldAccessesIn(condition).stream()
                    .filter(access -> !(access.getScope() instanceof ThisExpr) && !(access.getScope() instanceof SuperExpr))
                    .count();
            if (DOMAIN_WORD.matcher(condition.toString()).find()) {
                domainConditionals++;
            }
        }
        for (SwitchEntry entry : cu.findAll(SwitchEntry.class)) {
            if (entry.getLabels().stream().anyMatch(label -> DOMAIN_WORD.matcher(label.toString()).find())) {
                domainConditionals++;
            }
        }

        Set<Integer> codeLines = new HashSet<>();
        for (Statement statement : cu.findAll(Statement.class)) {
            if (!(statement instanceof BlockStmt)) {
                statement.getBegin().ifPresent(position -> codeLines.add(position.line));
            }
        }

        return StructuralSignals.builder()
                .implementation(hasImplementationType(cu))
                .codeLines(codeLines.size())
                .branchCount(branches)
                .callCount(cu.findAll(MethodCallExpr.class).size())
                .externalFieldAccessCount(fieldAccesses)
                .domainConditionalCount(domainConditionals)
                .build();
    }

    private static List<FieldAccessExpr> fieldAccessesIn(Node condition) {
        List<FieldAccessExpr> accesses = new ArrayList<>(condition.findAll(FieldAccessExpr.class));
        if (condition instanceof FieldAccessExpr access && !accesses.contains(access)) {
            accesses.add(access);
        }
        return accesses;
    }

    private static boolean hasImplementationType(CompilationUnit cu) {
        for (TypeDeclaration<?> type : cu.getTypes()) {
            if (!(type instanceof ClassOrInterfaceDeclaration declaration) || !declaration.isInterface()) {
                if (!type.isAnnotationDeclaration()) {
                    return true;
                }
            }
        }
        return false;
    }
}
