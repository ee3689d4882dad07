package com.prakash.focusplanner.service.agent;

import com.prakash.focusplanner.dto.AiSubtaskSuggestions;
import com.prakash.focusplanner.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Asks the chat model for a breakdown of a task into a handful of subtasks.
 * Suggestions are returned to the caller only; nothing is persisted here.
 */
@Service
public class SubtaskSuggestionAgent {

    private static final Logger log = LoggerFactory.getLogger(SubtaskSuggestionAgent.class);

    private static final int MAX_TITLE_LENGTH = 60;

    private final ChatModel chatModel;

    private final String suggestionPromptTemplate = """
            You are a task planning assistant for a productivity app. Your job is to break tasks into specific,
            actionable subtasks. Each subtask must start with a verb, be concise (under 60 characters),
            and be logically ordered.

            Break down the following task into 4-6 specific, actionable subtasks.

            Task: "{title}"
            {description}
            {existing}

            Return the subtasks in the required JSON format.

            {format}
            """;

    @Autowired
    public SubtaskSuggestionAgent(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    /**
     * Suggests subtasks for a task.
     *
     * @param title            title of the task to break down, must not be blank
     * @param description      optional task description, may be null
     * @param existingSubtasks titles already present; suggestions repeating them are dropped
     * @return the new suggestions, possibly empty
     */
    public List<String> suggestSubtasks(String title, String description, List<String> existingSubtasks) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Task title is required");
        }
        log.info("Requesting AI subtask suggestions for task '{}'", title.trim());

        BeanOutputConverter<AiSubtaskSuggestions> outputConverter = new BeanOutputConverter<>(AiSubtaskSuggestions.class);

        Map<String, Object> model = new HashMap<>();
        model.put("title", title.trim());
        model.put("description", description == null || description.isBlank()
                ? ""
                : "Description: \"" + description.trim() + "\"");
        model.put("existing", formatExisting(existingSubtasks));
        model.put("format", outputConverter.getFormat());
        Prompt prompt = new PromptTemplate(suggestionPromptTemplate).create(model);
        log.debug("Sending subtask suggestion prompt to AI: \n{}", prompt.getInstructions());

        AiSubtaskSuggestions suggestions;
        try {
            var chatResponse = chatModel.call(prompt);
            String rawResponse = chatResponse.getResult().getOutput().getText();
            log.debug("Received raw AI response for subtask suggestions: \n{}", rawResponse);
            suggestions = outputConverter.convert(rawResponse);
        } catch (Exception e) {
            log.error("Failed to generate or parse AI subtask suggestions: {}", e.getMessage(), e);
            throw new RuntimeException("AI subtask suggestion failed for task '" + title.trim() + "'", e);
        }

        if (suggestions == null || CollectionUtils.isEmpty(suggestions.getSubtasks())) {
            log.warn("AI response parsed, but no subtasks were suggested for '{}'", title.trim());
            return List.of();
        }
        List<String> cleaned = clean(suggestions.getSubtasks(), existingSubtasks);
        log.info("AI suggested {} new subtasks for '{}'", cleaned.size(), title.trim());
        return cleaned;
    }

    private String formatExisting(List<String> existingSubtasks) {
        if (CollectionUtils.isEmpty(existingSubtasks)) {
            return "";
        }
        return "The following subtasks already exist for this task. Do NOT repeat or rephrase these. "
                + "Generate ONLY new, different subtasks that complement the existing ones:\n"
                + existingSubtasks.stream().map(s -> "- " + s).collect(Collectors.joining("\n"));
    }

    // Trims, truncates, drops blanks and anything that repeats an existing title (case-insensitive)
    private List<String> clean(List<String> suggested, List<String> existingSubtasks) {
        Set<String> taken = existingSubtasks == null
                ? new LinkedHashSet<>()
                : existingSubtasks.stream()
                        .filter(s -> s != null)
                        .map(s -> s.trim().toLowerCase(Locale.ROOT))
                        .collect(Collectors.toCollection(LinkedHashSet::new));
        LinkedHashSet<String> result = new LinkedHashSet<>();
        for (String s : suggested) {
            if (s == null || s.isBlank()) {
                continue;
            }
            String title = s.trim();
            if (title.length() > MAX_TITLE_LENGTH) {
                title = title.substring(0, MAX_TITLE_LENGTH).trim();
            }
            if (taken.add(title.toLowerCase(Locale.ROOT))) {
                result.add(title);
            }
        }
        return List.copyOf(result);
    }
}
