package com.conveyal.coverage.process;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.util.JsonUtil;
import com.conveyal.file.FileCategory;
import com.conveyal.file.FileStorage;
import com.conveyal.file.FileStorageFormat;
import com.conveyal.file.FileStorageKey;
import com.conveyal.file.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps each process definition as a JSON file in the PROCESSES category of FileStorage, named after the process id.
 * The JSON is written to a scratch file first and moved into storage once complete.
 */
public class FileProcessDefinitionStore implements ProcessDefinitionStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileProcessDefinitionStore.class);

    private final FileStorage fileStorage;

    public FileProcessDefinitionStore (FileStorage fileStorage) {
        this.fileStorage = fileStorage;
    }

    static FileStorageKey keyFor (String processId) {
        return new FileStorageKey(FileCategory.PROCESSES, processId, FileStorageFormat.JSON.extension);
    }

    @Override
    public void save (ProcessDocument document) {
        File scratch = FileUtils.createScratchFile(FileStorageFormat.JSON.extension);
        try {
            JsonUtil.objectMapper.writerWithDefaultPrettyPrinter().writeValue(scratch, document.toJson());
            fileStorage.moveIntoStorage(keyFor(document.id), scratch);
        } catch (IOException e) {
            FileUtils.deleteScratchFile(scratch);
            throw CoverageProcessException.serializationError("Could not persist process " + document.id, e);
        }
    }

    @Override
    public List<ProcessDocument> loadAll () {
        List<ProcessDocument> documents = new ArrayList<>();
        for (FileStorageKey key : fileStorage.list(FileCategory.PROCESSES)) {
            if (FileStorageFormat.fromFilename(key.path) != FileStorageFormat.JSON) continue;
            try (InputStream inputStream = fileStorage.getInputStream(key)) {
                documents.add(ProcessDocument.fromJson(inputStream));
            } catch (IOException | CoverageProcessException e) {
                LOG.error("Skipping unreadable stored process definition {}: {}", key.path, e.toString());
            }
        }
        return documents;
    }

}
