package com.example.phoneshop.lisa.retrieval;

import com.example.phoneshop.lisa.model.Passage;
import com.example.phoneshop.lisa.model.PassageMetadata;

/** Placeholder indexed when the catalog is empty, so that searches still have something to rank. */
public final class SentinelPassage {

    public static final String ID = "welcome";

    private SentinelPassage() {
    }

    public static Passage welcome() {
        return new Passage(ID, "Chào mừng bạn đến với shop điện thoại!",
                new PassageMetadata(ID, "Welcome", null, null, null, "welcome"));
    }
}
