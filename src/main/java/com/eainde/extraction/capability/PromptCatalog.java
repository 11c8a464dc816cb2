package com.eainde.extraction.capability;

import com.eainde.extraction.classify.DocumentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompt templates loaded from {@code classpath:prompts/}.
 *
 * <p>Placeholders use the {@code {{NAME}}} form and are substituted verbatim.</p>
 */
@Slf4j
public class PromptCatalog {

    public static final String MICRO_SUMMARY = "micro_summary";
    public static final String FINAL_MERGE = "final_merge";
    public static final String GAP_REFILL = "gap_refill";

    private static final String BASE_PATH = "prompts/";
    private static final String SINGLE_PASS_PREFIX = "single_pass_";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z0-9_]+)}}");

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    /**
     * Substitutes every placeholder in one scan of the template, so text
     * inserted for one placeholder is never expanded again. Placeholders with
     * no value are left as they are.
     */
    public String render(String templateName, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(load(templateName));
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = values.containsKey(name)
                    ? Objects.requireNonNullElse(values.get(name), "")
                    : matcher.group();
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    /**
     * Single-pass template for {@code type}, falling back to the generic one
     * when no portal-specific template ships.
     */
    public String singlePassTemplateName(DocumentType type) {
        String name = SINGLE_PASS_PREFIX + type.name().toLowerCase(Locale.ROOT);
        if (new ClassPathResource(BASE_PATH + name + ".txt").exists()) {
            return name;
        }
        log.warn("Prompt template {} not found, falling back to generic", name);
        return SINGLE_PASS_PREFIX + DocumentType.GENERIC.name().toLowerCase(Locale.ROOT);
    }

    String load(String templateName) {
        return cache.computeIfAbsent(templateName, name -> {
            ClassPathResource resource = new ClassPathResource(BASE_PATH + name + ".txt");
            try (InputStream in = resource.getInputStream()) {
                return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot load prompt template " + name, e);
            }
        });
    }
}
