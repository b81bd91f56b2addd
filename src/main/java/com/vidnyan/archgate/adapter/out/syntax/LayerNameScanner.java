package com.vidnyan.archgate.adapter.out.syntax;

import com.vidnyan.archgate.domain.model.RawReference;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds references to feature layer classes ({@code ida_}, {@code prx_}, {@code poi_}) by name.
 * <p>
 * Object-oriented dialects reach other layers through class names in code, not only through
 * imports. Input lines must have comments and string contents blanked. Names the file declares
 * itself are not references.
 * </p>
 */
final class LayerNameScanner {

    private static final Pattern LAYER_NAME = Pattern.compile(
            "\\b((?:ida|prx|poi)_[A-Za-z0-9_]+)\\b", Pattern.CASE_INSENSITIVE);

    private final Pattern declaration;
    private final List<Pattern> skippedLines;

    /**
     * @param declaration  type declaration whose first group is the declared name
     * @param skippedLines lines already covered by directive references
     */
    LayerNameScanner(Pattern declaration, List<Pattern> skippedLines) {
        this.declaration = declaration;
        this.skippedLines = skippedLines;
    }

    /**
     * One reference per distinct name and line, in line order.
     */
    List<RawReference> scan(List<String> codeLines) {
        Set<String> declared = new HashSet<>();
        for (String line : codeLines) {
            Matcher matcher = declaration.matcher(line);
            while (matcher.find()) {
                declared.add(matcher.group(1).toLowerCase(Locale.ROOT));
            }
        }

        List<RawReference> references = new ArrayList<>();
        for (int i = 0; i < codeLines.size(); i++) {
            String line = codeLines.get(i);
            if (skippedLines.stream().anyMatch(skipped -> skipped.matcher(line).find())) {
                continue;
            }
            Set<String> seen = new LinkedHashSet<>();
            Matcher matcher = LAYER_NAME.matcher(line);
            while (matcher.find()) {
                String name = matcher.group(1);
                String key = name.toLowerCase(Locale.ROOT);
                if (!declared.contains(key) && seen.add(key)) {
                    references.add(RawReference.of(name, name, i + 1, false));
                }
            }
        }
        return references;
    }
}
