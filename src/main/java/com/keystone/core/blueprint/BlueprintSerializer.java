package com.keystone.core.blueprint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.keystone.core.model.Blueprint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the persisted blueprint as indented JSON. Absent optional values are
 * omitted, so {@code fromJson(toJson(b))} equals {@code b}.
 */
@Component
public class BlueprintSerializer {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public String toJson(Blueprint blueprint) {
        try {
            return mapper.writeValueAsString(blueprint);
        } catch (JsonProcessingException e) {
            throw new BlueprintFormatException("Cannot serialize blueprint: " + e.getOriginalMessage(), e);
        }
    }

    public Blueprint fromJson(String json) {
        try {
            Blueprint blueprint = mapper.readValue(json, Blueprint.class);
            if (blueprint == null) {
                throw new BlueprintFormatException("Blueprint document is empty");
            }
            return blueprint;
        } catch (JsonProcessingException e) {
            throw new BlueprintFormatException("Cannot parse blueprint: " + e.getOriginalMessage(), e);
        }
    }

    public void write(Blueprint blueprint, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(blueprint) + "\n", StandardCharsets.UTF_8);
    }

    public Blueprint read(Path file) throws IOException {
        return fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }
}
