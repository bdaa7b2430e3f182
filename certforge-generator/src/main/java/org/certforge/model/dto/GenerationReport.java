package org.certforge.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.List;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerationReport {
    private List<String> variants;
    private String activeVariant;
    private List<Path> renderedFiles;
    private List<Path> publishedFiles;
    private long durationMs;
}
