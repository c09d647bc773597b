package com.raditha.cyclone.cli;

import com.raditha.cyclone.model.SourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Builds a {@link SourceRepository} from a local directory.
 * File identifiers are paths relative to the directory, with '/' separators.
 */
public class SourceCollector {

    private static final Logger logger = LoggerFactory.getLogger(SourceCollector.class);

    private final String extension;
    private final Predicate<String> excluded;

    /**
     * @param extension file name suffix to collect, e.g. ".java"
     * @param excluded  tested against each relative file id; matching files are skipped
     */
    public SourceCollector(String extension, Predicate<String> excluded) {
        this.extension = extension;
        this.excluded = excluded;
    }

    /**
     * Read all matching files below {@code root}.
     *
     * @param repositoryId identifier of the repository in reports
     * @param root         directory to walk
     * @throws IOException if the directory cannot be walked or a file cannot be read
     */
    public SourceRepository collect(String repositoryId, Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .sorted()
                    .toList();
        }

        Map<String, String> files = new TreeMap<>();
        int skipped = 0;
        for (Path path : paths) {
            String fileId = toFileId(root, path);
            if (excluded.test(fileId)) {
                skipped++;
                continue;
            }
            // malformed bytes become replacement characters and surface as parse errors
            files.put(fileId, new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
        }
        logger.info("Collected {} files from {} ({} excluded)", files.size(), root, skipped);
        return new SourceRepository(repositoryId, files);
    }

    static String toFileId(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
