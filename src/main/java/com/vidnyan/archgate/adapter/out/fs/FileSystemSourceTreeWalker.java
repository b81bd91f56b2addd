package com.vidnyan.archgate.adapter.out.fs;

import com.vidnyan.archgate.application.port.out.SourceTreeWalker;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Walks a code root on the local file system.
 * Hidden entries (any path segment starting with a dot) are skipped.
 */
@Component
public class FileSystemSourceTreeWalker implements SourceTreeWalker {

    @Override
    public List<Path> listFiles(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> !isHidden(root.relativize(p)))
                    .sorted()
                    .toList();
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
