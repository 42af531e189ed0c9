package org.carball.relinfer.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.exception.ConfigurationException;
import org.carball.relinfer.model.candidate.LinkDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Declared links exported by the source system as a JSON array of descriptors.
 */
@Slf4j
public class JsonLinkDescriptorSource implements SchemaMetadataSource {

    private final Path file;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public JsonLinkDescriptorSource(Path file) {
        this.file = file;
    }

    @Override
    public List<LinkDescriptor> listDeclaredLinks() {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Link descriptor file not found: " + file);
        }
        try {
            List<LinkDescriptor> links = objectMapper.readValue(file.toFile(), new TypeReference<List<LinkDescriptor>>() {});
            log.info("Loaded {} declared links from {}", links.size(), file);
            return links;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse link descriptors " + file + ": " + e.getMessage(), e);
        }
    }
}
