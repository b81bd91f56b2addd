package com.vidnyan.archgate.application.service;

import com.vidnyan.archgate.application.port.in.GateConfigurationException;
import com.vidnyan.archgate.application.port.out.SyntaxAdapter;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps file extensions to syntax adapters. The dialect of a file is chosen by extension only.
 */
public class SyntaxAdapterRegistry {

    private final List<SyntaxAdapter> adapters;
    private final Map<String, SyntaxAdapter> byExtension = new HashMap<>();

    public SyntaxAdapterRegistry(List<SyntaxAdapter> adapters) {
        this.adapters = adapters.stream()
                .sorted(Comparator.comparing(SyntaxAdapter::dialectId))
                .toList();
        for (SyntaxAdapter adapter : this.adapters) {
            for (String extension : adapter.fileExtensions()) {
                SyntaxAdapter previous = byExtension.putIfAbsent(extension.toLowerCase(Locale.ROOT), adapter);
                if (previous != null) {
                    throw new GateConfigurationException("Extension " + extension + " is claimed by both "
                            + previous.dialectId() + " and " + adapter.dialectId());
                }
            }
        }
    }

    public List<SyntaxAdapter> adapters() {
        return adapters;
    }

    public Optional<SyntaxAdapter> forDialect(String dialectId) {
        return adapters.stream().filter(adapter -> adapter.dialectId().equals(dialectId)).findFirst();
    }

    public Optional<SyntaxAdapter> forFile(Path file) {
        return Optional.ofNullable(byExtension.get(extensionOf(file)));
    }

    /**
     * Lower-case extension with leading dot, empty when the file has none.
     */
    public static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
