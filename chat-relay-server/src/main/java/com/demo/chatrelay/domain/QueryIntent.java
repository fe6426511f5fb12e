package com.demo.chatrelay.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of matching an assistant prompt against the project/task/profile vocabulary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryIntent {

    private boolean dataQuery;
    private QueryType queryType;
    private List<String> keywords;

    public enum QueryType {
        PROJECT, TASK, PROFILE, GENERAL
    }
}
