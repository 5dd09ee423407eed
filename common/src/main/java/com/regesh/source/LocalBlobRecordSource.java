package com.regesh.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regesh.model.InputRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads blobs from a directory tree laid out as {@code <root>/<container>/<blob>}.
 */
@Slf4j
public class LocalBlobRecordSource implements RecordSource {

    private final Path root;
    private final ObjectMapper objectMapper;

    public LocalBlobRecordSource(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    public LocalBlobRecordSource(Path root) {
        this(root, new ObjectMapper());
    }

    @Override
    public List<InputRecord> fetch(String container, String blobName) throws IOException {
        Path blob = root.resolve(container).resolve(blobName);
        log.info("Downloading blob {} from container {} ({})", blobName, container, blob);

        if (!Files.isRegularFile(blob)) {
            throw new NoSuchFileException(blob.toString(), null, "blob not found");
        }

        JsonNode document = objectMapper.readTree(blob.toFile());
        if (document == null || !document.isArray()) {
            throw new IOException("Blob " + container + "/" + blobName + " is not a JSON array");
        }

        List<InputRecord> records = new ArrayList<>(document.size());
        for (int i = 0; i < document.size(); i++) {
            JsonNode element = document.get(i);
            if (!element.isObject()) {
                throw new IOException("Element " + i + " of " + container + "/" + blobName
                        + " is not a JSON object");
            }
            records.add(objectMapper.treeToValue(element, InputRecord.class));
        }

        log.info("Loaded {} records", records.size());
        return records;
    }
}
