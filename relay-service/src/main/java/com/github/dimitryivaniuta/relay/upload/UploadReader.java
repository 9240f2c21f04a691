package com.github.dimitryivaniuta.relay.upload;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.relay.error.InvalidUploadException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the {@link PayloadFileReader} for an uploaded file by its extension.
 */
@Slf4j
@Component
public class UploadReader {

    private final List<PayloadFileReader> readers;
    private final String supported;

    public UploadReader(List<PayloadFileReader> readers) {
        this.readers = List.copyOf(readers);
        TreeSet<String> all = new TreeSet<>();
        readers.forEach(r -> all.addAll(r.extensions()));
        this.supported = String.join(", ", all.stream().map(e -> "." + e).toList());
    }

    public boolean supports(String filename) {
        return readerFor(filename).isPresent();
    }

    /** Fails when the type is unsupported, the file is empty or it holds no data rows. */
    public List<ObjectNode> read(String filename, byte[] content) {
        PayloadFileReader reader = readerFor(filename).orElseThrow(() -> unsupported(filename));
        if (content == null || content.length == 0) {
            throw new InvalidUploadException("Uploaded file '" + filename + "' is empty");
        }
        List<ObjectNode> rows = reader.read(filename, content);
        if (rows.isEmpty()) {
            throw new InvalidUploadException("File '" + filename + "' has no data rows");
        }
        log.debug("Parsed {} row(s) from {}", rows.size(), filename);
        return rows;
    }

    public InvalidUploadException unsupported(String filename) {
        return new InvalidUploadException("Unsupported file type '" + filename + "'; expected one of " + supported);
    }

    private Optional<PayloadFileReader> readerFor(String filename) {
        String ext = extension(filename);
        return readers.stream().filter(r -> r.extensions().contains(ext)).findFirst();
    }

    private static String extension(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
