package com.prakash.focusplanner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor // Necessary for BeanOutputConverter
@AllArgsConstructor
public class AiSubtaskSuggestions {

    // Short, verb-first subtask titles in the order they should be done
    private List<String> subtasks;
}
