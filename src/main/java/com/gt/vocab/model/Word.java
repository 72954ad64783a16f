package com.gt.vocab.model;

import java.util.Collections;
import java.util.List;

public record Word(String id, String text, String level, String exampleEn, String exampleRu, List<String> tags) {

    public Word {
        tags = tags == null ? List.of() : Collections.unmodifiableList(tags);
    }
}
