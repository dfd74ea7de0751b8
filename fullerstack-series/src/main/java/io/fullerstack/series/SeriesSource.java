package io.fullerstack.series;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Opens the byte stream a dataset is read from. Called once per load; the
 * caller closes the stream.
 */
@FunctionalInterface
public interface SeriesSource {

    InputStream open() throws IOException;

    static SeriesSource ofPath(Path path) {
        Objects.requireNonNull(path, "path cannot be null");
        return () -> Files.newInputStream(path);
    }

    static SeriesSource ofClasspath(String resource) {
        Objects.requireNonNull(resource, "resource cannot be null");
        return () -> {
            InputStream in = SeriesSource.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new FileNotFoundException("No classpath resource '" + resource + "'");
            }
            return in;
        };
    }

    static SeriesSource ofString(String content) {
        Objects.requireNonNull(content, "content cannot be null");
        return () -> new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
