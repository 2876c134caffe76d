package com.company.cropstress.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class EncodingResult {
    private final List<Embedding> embeddings;
    private final List<Patch> excluded;
}
