package com.focus.gate.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

import java.util.List;
import java.util.Objects;

@Builder(toBuilder = true)
public record PageMetadata(
        @NotBlank String url,
        String title,
        String description,
        List<String> keywords,
        String extractedText,
        int contentLength,
        int linkCount,
        boolean hasVideo,
        boolean hasForms,
        int educationalIndicators,
        int entertainmentIndicators,
        double qualityScore
) {

    public PageMetadata {
        url = url == null ? "" : url;
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        extractedText = extractedText == null ? "" : extractedText;
        keywords = keywords == null
                ? List.of()
                : keywords.stream().filter(Objects::nonNull).toList();
    }

    public static PageMetadata basic(String url) {
        return PageMetadata.builder().url(url).build();
    }

    public boolean sparse() {
        return title.isBlank() && description.isBlank();
    }

    public String alignmentText() {
        return (title + "\n" + description).trim();
    }
}
