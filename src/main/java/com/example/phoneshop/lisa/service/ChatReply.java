package com.example.phoneshop.lisa.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatReply(
        @JsonProperty("thread_id") String threadId,
        @JsonProperty("route") String route,
        @JsonProperty("response") String response,
        @JsonProperty("info_count") int infoCount,
        @JsonProperty("notices") List<String> notices
) {
}
