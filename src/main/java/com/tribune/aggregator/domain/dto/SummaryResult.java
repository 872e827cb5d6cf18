package com.tribune.aggregator.domain.dto;

import java.util.List;

public record SummaryResult(boolean success, String summary, List<String> sentences, String method, String error) {

    public static final String EXTRACTIVE = "extractive";

    public static SummaryResult failed(String error) {
        return new SummaryResult(false, "", List.of(), EXTRACTIVE, error);
    }
}
