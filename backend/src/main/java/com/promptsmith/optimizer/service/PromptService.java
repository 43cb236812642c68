package com.promptsmith.optimizer.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads prompt templates from {@code classpath:prompts/} and fills their placeholders.
 *
 * <p>Templates use {@code {{NAME}}} for values and {@code {{#NAME}}...{{/NAME}}} for sections
 * that are kept only when {@code NAME} has a non-blank value.
 */
@Slf4j
@Service
public class PromptService {

  private static final String PROMPTS_PATH = "prompts/";
  private static final Pattern SECTION =
      Pattern.compile("(?s)\\{\\{#([A-Z_]+)\\}\\}(.*?)\\{\\{/\\1\\}\\}");

  private final Map<String, String> templates = new ConcurrentHashMap<>();

  public String loadPromptTemplate(String promptName) throws IOException {
    String fileName = PROMPTS_PATH + promptName + ".txt";
    ClassPathResource resource = new ClassPathResource(fileName);

    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
      return reader.lines().collect(Collectors.joining("\n"));
    } catch (IOException e) {
      log.error("Failed to load prompt template: {}", fileName, e);
      throw new IOException("Failed to load prompt template: " + fileName, e);
    }
  }

  public String render(String promptName, Map<String, String> values) {
    String template =
        templates.computeIfAbsent(
            promptName,
            name -> {
              try {
                return loadPromptTemplate(name);
              } catch (IOException e) {
                throw new UncheckedIOException(e);
              }
            });

    Matcher sections = SECTION.matcher(template);
    StringBuilder withSections = new StringBuilder();
    while (sections.find()) {
      String value = values.get(sections.group(1));
      String replacement = value != null && !value.isBlank() ? sections.group(2) : "";
      sections.appendReplacement(withSections, Matcher.quoteReplacement(replacement));
    }
    sections.appendTail(withSections);

    String prompt = withSections.toString();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      prompt =
          prompt.replace(
              "{{" + entry.getKey() + "}}", entry.getValue() != null ? entry.getValue() : "");
    }
    return prompt;
  }
}
