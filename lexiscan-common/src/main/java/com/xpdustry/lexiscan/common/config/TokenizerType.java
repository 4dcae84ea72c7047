package com.xpdustry.lexiscan.common.config;

import com.google.gson.annotations.SerializedName;

public enum TokenizerType {
    @SerializedName("word")
    WORD,
    @SerializedName("character")
    CHARACTER
}
