package com.netcourier.enrichment.service.chunking;

import com.netcourier.enrichment.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class TextWindowSplitter {

    private final int windowSize;

    @Autowired
    public TextWindowSplitter(PipelineProperties properties) {
        this(properties.getChunking().getWindowSize());
    }

    public TextWindowSplitter(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        this.windowSize = windowSize;
    }

    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> paragraphs = Arrays.stream(text.split("\r?\n\\s*\r?\n"))
                .map(String::trim)
                .filter(paragraph -> !paragraph.isBlank())
                .collect(Collectors.toCollection(ArrayList::new));
        List<String> windows = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String paragraph : paragraphs) {
            for (String piece : fit(paragraph)) {
                if (current.length() > 0 && current.length() + piece.length() + 2 > windowSize) {
                    windows.add(current.toString());
                    current = new StringBuilder();
                }
                if (current.length() > 0) {
                    current.append("\n\n");
                }
                current.append(piece);
            }
        }
        if (current.length() > 0) {
            windows.add(current.toString());
        }
        return windows;
    }

    private List<String> fit(String paragraph) {
        if (paragraph.length() <= windowSize) {
            return List.of(paragraph);
        }
        List<String> pieces = new ArrayList<>();
        String rest = paragraph;
        while (rest.length() > windowSize) {
            int cut = rest.lastIndexOf(' ', windowSize);
            if (cut <= 0) {
                cut = windowSize;
            }
            pieces.add(rest.substring(0, cut).trim());
            rest = rest.substring(cut).trim();
        }
        if (!rest.isEmpty()) {
            pieces.add(rest);
        }
        return pieces;
    }
}
