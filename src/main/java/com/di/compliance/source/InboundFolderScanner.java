package com.di.compliance.source;

import com.di.compliance.config.IngestionProperties;
import com.di.compliance.exception.IngestionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers candidate documents in the inbound folder.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundFolderScanner {

    private final IngestionProperties properties;

    public List<Path> scan() {
        return scan(Paths.get(properties.getInboundPath()));
    }

    /**
     * Regular files whose names end with a configured extension, sorted by path.
     *
     * @throws IngestionException when the folder does not exist or cannot be listed
     */
    public List<Path> scan(Path folder) {
        if (!Files.isDirectory(folder)) {
            throw new IngestionException("Folder not found: " + folder.toAbsolutePath());
        }
        List<String> suffixes = properties.getExtensions().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
        int depth = properties.isRecursive() ? Integer.MAX_VALUE : 1;

        try (Stream<Path> paths = Files.walk(folder, depth)) {
            List<Path> files = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> matches(p, suffixes))
                    .sorted()
                    .collect(Collectors.toList());
            log.info("[SCAN] folder={} files={}", folder, files.size());
            return files;
        } catch (IOException e) {
            throw new IngestionException("Failed to scan folder " + folder, e);
        }
    }

    private static boolean matches(Path path, List<String> suffixes) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return suffixes.stream().anyMatch(name::endsWith);
    }
}
