package com.vidnyan.archgate.application.service;

import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Severity;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Hygiene checks over {@code specs/*.md} and {@code README.md} of a documentation root.
 * All findings are ERROR severity.
 */
@Slf4j
public class DocumentationHygieneChecker {

    public static final String SPECS_MISSING = "doc-specs-missing";
    public static final String FILENAME_INVALID = "doc-filename-invalid";
    public static final String ENCODING = "doc-encoding";
    public static final String EMPTY = "doc-empty";
    public static final String H1_NUMBER = "doc-h1-number";
    public static final String HEADING_NUMBERING = "doc-heading-numbering";
    public static final String README_MISSING = "doc-readme-missing";
    public static final String README_ENCODING = "doc-readme-encoding";

    private static final String SPECS_DIR = "specs";
    private static final String README = "README.md";
    private static final char REPLACEMENT_CHARACTER = '\uFFFD';

    private static final Pattern FILE_NAME = Pattern.compile(
            "^(?:(?<num>\\d{2})|A(?<appendix>\\d+))_(?<slug>[a-z0-9_]+)\\.md$");
    private static final Pattern NUMBERED_H1 = Pattern.compile("^#\\s*(?<n>\\d+)\\.\\s+");
    private static final Pattern APPENDIX_H1 = Pattern.compile("^#\\s*Appendix\\s+[A-Z]\\.");
    private static final Pattern NUMBERED_HEADING = Pattern.compile("^(#{2,6})\\s+(?<n>\\d+)\\.(.*)$");
    private static final Pattern QUESTION_MARK_RUN = Pattern.compile("\\?{2,}");

    public DocCheck check(Path docRoot) {
        List<Finding> findings = new ArrayList<>();
        int files = 0;

        Path specsDir = docRoot.resolve(SPECS_DIR);
        List<Path> specFiles = listMarkdown(specsDir);
        if (specFiles.isEmpty()) {
            findings.add(error(SPECS_MISSING, SPECS_DIR, Finding.NO_LINE,
                    Files.isDirectory(specsDir) ? "No spec files found in specs/" : "Missing folder: specs/"));
        }
        for (Path specFile : specFiles) {
            files++;
            checkSpecFile(specFile, findings);
        }

        Path readme = docRoot.resolve(README);
        if (Files.isRegularFile(readme)) {
            files++;
            String text = read(readme);
            if (text.indexOf(REPLACEMENT_CHARACTER) >= 0) {
                findings.add(error(README_ENCODING, README, Finding.NO_LINE,
                        "Encoding replacement character (U+FFFD) found"));
            }
            if (QUESTION_MARK_RUN.matcher(text).find()) {
                findings.add(error(README_ENCODING, README, Finding.NO_LINE,
                        "Suspicious '??' sequences found (likely encoding artifacts)"));
            }
        } else {
            findings.add(error(README_MISSING, README, Finding.NO_LINE, "README.md not found"));
        }

        findings.sort(Finding.ORDER);
        log.debug("  Checked {} documentation files, {} findings", files, findings.size());
        return new DocCheck(files, findings);
    }

    private void checkSpecFile(Path specFile, List<Finding> findings) {
        String name = specFile.getFileName().toString();
        String path = SPECS_DIR + "/" + name;
        Matcher nameMatcher = FILE_NAME.matcher(name);
        if (!nameMatcher.matches()) {
            findings.add(error(FILENAME_INVALID, path, Finding.NO_LINE,
                    "Invalid document filename under specs/ (expected NN_slug.md or A#_slug.md)"));
            return;
        }
        Integer fileNumber = nameMatcher.group("num") != null ? Integer.valueOf(nameMatcher.group("num")) : null;

        String text = read(specFile);
        if (text.indexOf(REPLACEMENT_CHARACTER) >= 0) {
            findings.add(error(ENCODING, path, Finding.NO_LINE, "Encoding replacement character (U+FFFD) found"));
        }

        List<String> lines = text.lines().toList();
        int firstLine = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                firstLine = i;
                break;
            }
        }
        if (firstLine < 0) {
            findings.add(error(EMPTY, path, Finding.NO_LINE, "Empty file"));
            return;
        }

        String h1 = lines.get(firstLine);
        Matcher h1Matcher = NUMBERED_H1.matcher(h1);
        if (h1Matcher.find()) {
            int h1Number = Integer.parseInt(h1Matcher.group("n"));
            if (fileNumber != null && h1Number != fileNumber) {
                findings.add(error(H1_NUMBER, path, firstLine + 1, String.format(Locale.ROOT,
                        "H1 section number mismatch (H1=%d, filename=%02d)", h1Number, fileNumber)));
            }
            if (fileNumber != null) {
                checkHeadingNumbering(path, lines, h1Number, findings);
            }
        } else if (!APPENDIX_H1.matcher(h1).find()) {
            findings.add(error(H1_NUMBER, path, firstLine + 1,
                    "H1 does not start with a section number (expected '# N. ...' or '# Appendix X. ...')"));
        }
    }

    /**
     * Numbered sub-headings either all carry the H1 number or are locally numbered from 1.
     */
    private void checkHeadingNumbering(String path, List<String> lines, int h1Number, List<Finding> findings) {
        TreeSet<Integer> numbers = new TreeSet<>();
        int firstHeading = -1;
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = NUMBERED_HEADING.matcher(lines.get(i));
            if (matcher.matches()) {
                numbers.add(Integer.parseInt(matcher.group("n")));
                if (firstHeading < 0) {
                    firstHeading = i;
                }
            }
        }
        if (numbers.isEmpty()) {
            return;
        }
        boolean prefixed = numbers.size() == 1 && numbers.first() == h1Number;
        boolean local = numbers.contains(1);
        if (!prefixed && !local) {
            findings.add(error(HEADING_NUMBERING, path, firstHeading + 1,
                    "Numbered headings do not match H1 number and do not start at 1: '"
                            + lines.get(firstHeading).strip() + "'"));
        }
    }

    private static List<Path> listMarkdown(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.list(dir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".md"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
    }

    private static String read(Path file) {
        try {
            return SourceModelBuilder.readText(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    private static Finding error(String ruleId, String path, int line, String message) {
        return new Finding(ruleId, Severity.ERROR, path, line, message);
    }

    /**
     * Outcome of one documentation check.
     */
    public record DocCheck(int filesScanned, List<Finding> findings) {}
}
