package com.scholar.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class JsonTrainingSetLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void readsLabeledDocuments() throws IOException {
        Path file = tempDir.resolve("train.json");
        Files.writeString(file, "[{\"text\": \"Budget vote\", \"category\": \" politics \"}]");

        List<TrainingDocument> documents = loader(file.toUri().toString()).load();

        assertEquals(List.of(new TrainingDocument("Budget vote", "politics")), documents);
    }

    @Test
    void nullEntriesAreSkipped() throws IOException {
        Path file = tempDir.resolve("sparse.json");
        Files.writeString(file, "[null, {\"text\": \"Hospital funding\", \"category\": \"health\"}, null]");

        List<TrainingDocument> documents = loader(file.toUri().toString()).load();

        assertEquals(List.of(new TrainingDocument("Hospital funding", "health")), documents);
    }

    @Test
    void missingFileUsesFallbackDocuments() {
        List<TrainingDocument> documents = loader(tempDir.resolve("missing.json").toUri().toString()).load();

        assertEquals(JsonTrainingSetLoader.FALLBACK_DOCUMENTS, documents);
    }

    @Test
    void malformedFileFails() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "[{");

        assertThrows(UncheckedIOException.class, () -> loader(file.toUri().toString()).load());
    }

    private JsonTrainingSetLoader loader(String location) {
        ClassifierProperties properties = new ClassifierProperties();
        properties.setTrainingLocation(location);
        return new JsonTrainingSetLoader(properties, new DefaultResourceLoader(), new ObjectMapper());
    }
}
