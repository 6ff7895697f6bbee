package com.purchasingpower.compliancekb.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.compliancekb.model.prompt.PromptTemplate;
import com.purchasingpower.compliancekb.model.prompt.RenderedPrompt;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads answer prompts from YAML and renders them with Mustache.
 *
 * <pre>
 * RenderedPrompt prompt = promptLibrary.render("incident-answer", Map.of(
 *     "question", "Which teams handle phishing?",
 *     "context", contextBlocks
 * ));
 * </pre>
 *
 * Use triple braces ({@code {{{context}}}}) in templates for values that must not be HTML-escaped.
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver()
                    .getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }

            log.info("Loaded {} prompt templates", templates.size());
        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    public RenderedPrompt render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        return new RenderedPrompt(
                renderPart(templateName + ".system", template.getSystemPrompt(), variables),
                renderPart(templateName + ".user", template.getUserPrompt(), variables));
    }

    private String renderPart(String name, String text, Map<String, Object> variables) {
        if (text == null) {
            return "";
        }
        Mustache mustache = mustacheFactory.compile(new StringReader(text), name);
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString().trim();
    }
}
