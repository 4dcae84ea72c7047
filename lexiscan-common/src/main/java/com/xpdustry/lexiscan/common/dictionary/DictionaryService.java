package com.xpdustry.lexiscan.common.dictionary;

import com.xpdustry.lexiscan.common.search.Match;
import java.util.List;
import java.util.stream.Stream;

public interface DictionaryService {

    Stream<Match<String>> scan(final String buffer);

    default List<Match<String>> find(final String buffer) {
        return this.scan(buffer).toList();
    }

    int size();
}
