package com.xpdustry.lexiscan.common.config;

import com.google.gson.annotations.SerializedName;

public enum NormalizerType {
    @SerializedName("simple")
    SIMPLE,
    @SerializedName("folding")
    FOLDING
}
