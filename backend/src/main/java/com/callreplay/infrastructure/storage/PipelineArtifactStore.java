package com.callreplay.infrastructure.storage;

import com.callreplay.domain.analysis.model.CallTranscript;
import com.callreplay.domain.analysis.model.PipelineResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One JSON file per raw transcript and per pipeline run, next to the result store.
 * Saving a transcript whose call id already exists overwrites the previous file.
 */
@Slf4j
@Component
public class PipelineArtifactStore {

    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final ObjectMapper objectMapper;
    private final Path dataDir;

    public PipelineArtifactStore(ObjectMapper objectMapper,
                                 @Value("${storage.data-dir:data}") String dataDir) {
        this.objectMapper = objectMapper;
        this.dataDir = Path.of(dataDir);
    }

    public Path saveTranscript(CallTranscript transcript) {
        Path file = transcriptFile(transcript.callId());
        write(file, transcript);
        log.debug("Stored transcript {} at {}", transcript.callId(), file);
        return file;
    }

    Optional<CallTranscript> findTranscript(String callId) {
        Path file = transcriptFile(callId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), CallTranscript.class));
        } catch (IOException e) {
            throw new StorageException("Failed to read transcript " + callId, e);
        }
    }

    public Path savePipelineResult(PipelineResult result) {
        Path file = dataDir.resolve(safeName(result.pipelineId()) + ".json");
        write(file, result);
        log.info("Pipeline result saved: {}", file);
        return file;
    }

    private Path transcriptFile(String callId) {
        return dataDir.resolve("transcript_" + safeName(callId) + ".json");
    }

    private void write(Path file, Object document) {
        try {
            Files.createDirectories(dataDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), document);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + file, e);
        }
    }

    static String safeName(String id) {
        return UNSAFE_FILE_CHARS.matcher(String.valueOf(id)).replaceAll("_");
    }
}
