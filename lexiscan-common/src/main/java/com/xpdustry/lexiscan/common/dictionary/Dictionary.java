package com.xpdustry.lexiscan.common.dictionary;

import com.xpdustry.lexiscan.common.collection.Trie;

public record Dictionary(String source, Trie<String> trie, int entries) {}
