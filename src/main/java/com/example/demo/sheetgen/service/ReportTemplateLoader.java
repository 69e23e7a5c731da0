package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.aspect.LogExecutionTime;
import com.example.demo.sheetgen.exception.TemplateConfigException;
import com.example.demo.sheetgen.model.ReportTemplate;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads report templates from YAML.
 * <p>
 * Template ids are resolved against the classpath first and the file system
 * second, trying {@code <id>}, {@code templates/<id>} and both with the
 * {@code .yaml} and {@code .yml} extensions. Only raw bytes are cached; every
 * parse returns a fresh template because exporters mutate the template they own.
 */
@Slf4j
@Component
public class ReportTemplateLoader {
    private static final String[] EXTENSIONS = {".yaml", ".yml"};

    private final ObjectMapper yamlMapper = createYamlMapper();

    static ObjectMapper createYamlMapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Raw template bytes for the given id. Cached; parse with {@link #parse(byte[], String)}.
     *
     * @throws TemplateConfigException TEMPLATE_NOT_FOUND when no candidate location exists
     */
    @LogExecutionTime("Loading Template Source")
    @Cacheable(value = "reportTemplateSources", key = "#templateId")
    public byte[] loadTemplateSource(String templateId) {
        for (String candidate : buildCandidatePaths(templateId)) {
            try {
                ClassPathResource resource = new ClassPathResource(candidate);
                if (resource.exists()) {
                    try (InputStream in = resource.getInputStream()) {
                        log.info("Loaded template from classpath resource: {}", candidate);
                        return in.readAllBytes();
                    }
                }
                Path path = Path.of(candidate);
                if (Files.isRegularFile(path)) {
                    log.info("Loaded template from file system: {}", path.toAbsolutePath());
                    return Files.readAllBytes(path);
                }
            } catch (IOException e) {
                throw new TemplateConfigException("TEMPLATE_READ_ERROR", "Failed to read template: " + candidate, e);
            }
        }
        throw new TemplateConfigException("TEMPLATE_NOT_FOUND",
                "Template not found for id '" + templateId + "'. Checked: " + buildCandidatePaths(templateId));
    }

    public ReportTemplate parse(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            throw new TemplateConfigException("EMPTY_TEMPLATE", "Template content is empty");
        }
        return parse(yaml.getBytes(StandardCharsets.UTF_8), "<inline>");
    }

    /**
     * @param source name used in error messages
     */
    public ReportTemplate parse(byte[] content, String source) {
        if (content == null || new String(content, StandardCharsets.UTF_8).isBlank()) {
            throw new TemplateConfigException("EMPTY_TEMPLATE", "Template content is empty: " + source);
        }
        ReportTemplate template;
        try {
            template = yamlMapper.readValue(content, ReportTemplate.class);
        } catch (IOException e) {
            log.error("Failed to parse YAML template: {}", source, e);
            throw new TemplateConfigException("TEMPLATE_PARSE_ERROR", "Failed to parse YAML template: " + source, e);
        }
        if (template == null) {
            throw new TemplateConfigException("EMPTY_TEMPLATE", "Template content is empty: " + source);
        }
        if (template.getSheets() == null) {
            template.setSheets(new ArrayList<>());
        }
        log.debug("Parsed template {} with {} sheets", source, template.getSheets().size());
        return template;
    }

    private List<String> buildCandidatePaths(String templateId) {
        List<String> candidates = new ArrayList<>();
        candidates.add(templateId);
        candidates.add("templates/" + templateId);
        for (String ext : EXTENSIONS) {
            candidates.add(templateId + ext);
            candidates.add("templates/" + templateId + ext);
        }
        return candidates;
    }
}
