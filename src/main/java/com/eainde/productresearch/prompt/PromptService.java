package com.eainde.productresearch.prompt;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads prompt templates from {@code classpath:prompts/<key>.txt} and fills their
 * {@code {name}} placeholders in a single pass, so substituted values are never expanded again.
 * Unknown placeholders and literal JSON braces are left untouched.
 */
@Service
public class PromptService {

    public static final String FILTER = "filter";
    public static final String VALIDATION = "validation";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public String render(String key, Map<String, String> variables) {
        Matcher matcher = PLACEHOLDER.matcher(template(key));
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = variables.containsKey(name)
                    ? (variables.get(name) == null ? "" : variables.get(name))
                    : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    String template(String key) {
        return templates.computeIfAbsent(key, this::load);
    }

    private String load(String key) {
        ClassPathResource resource = new ClassPathResource("prompts/" + key + ".txt");
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Prompt template not found: " + key, e);
        }
    }
}
