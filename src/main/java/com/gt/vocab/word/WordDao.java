package com.gt.vocab.word;

import com.gt.vocab.model.Word;

import java.util.Collection;
import java.util.List;

public interface WordDao {

    // Ids with no catalog entry are left out of the result
    List<Word> loadWords(Collection<String> wordIds);
}
