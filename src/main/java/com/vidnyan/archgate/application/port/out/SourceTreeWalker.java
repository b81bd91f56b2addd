package com.vidnyan.archgate.application.port.out;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for enumerating files under a root.
 */
public interface SourceTreeWalker {

    /**
     * All regular files under the root, sorted by path.
     */
    List<Path> listFiles(Path root) throws IOException;
}
