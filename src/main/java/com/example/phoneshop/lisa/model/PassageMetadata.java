package com.example.phoneshop.lisa.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PassageMetadata(
    @JsonProperty("product_id") String productId,
    @JsonProperty("title") String title,
    @JsonProperty("url") String url,
    @JsonProperty("price") String price,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("topic") String topic
) {

  public static final String PRODUCT_ID = "product_id";
  public static final String TITLE = "title";
  public static final String URL = "url";
  public static final String PRICE = "price";
  public static final String IMAGE_URL = "image_url";
  public static final String TOPIC = "topic";

  public static PassageMetadata empty() {
    return new PassageMetadata(null, null, null, null, null, null);
  }

  /** Builds metadata from a loosely typed store map; numbers such as price are stringified. */
  public static PassageMetadata fromMap(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) {
      return empty();
    }
    return new PassageMetadata(
        text(raw.get(PRODUCT_ID)),
        text(raw.get(TITLE)),
        text(raw.get(URL)),
        text(raw.get(PRICE)),
        text(raw.get(IMAGE_URL)),
        text(raw.get(TOPIC)));
  }

  /** Non-null entries only, in a stable order. */
  public Map<String, String> toMap() {
    Map<String, String> out = new LinkedHashMap<>();
    putIfPresent(out, PRODUCT_ID, productId);
    putIfPresent(out, TITLE, title);
    putIfPresent(out, URL, url);
    putIfPresent(out, PRICE, price);
    putIfPresent(out, IMAGE_URL, imageUrl);
    putIfPresent(out, TOPIC, topic);
    return out;
  }

  private static void putIfPresent(Map<String, String> out, String key, String value) {
    if (value != null && !value.isBlank()) {
      out.put(key, value);
    }
  }

  private static String text(Object value) {
    if (value == null) {
      return null;
    }
    String s = String.valueOf(value).trim();
    return s.isEmpty() ? null : s;
  }
}
