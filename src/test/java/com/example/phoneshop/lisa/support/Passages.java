package com.example.phoneshop.lisa.support;

import com.example.phoneshop.lisa.model.Passage;
import com.example.phoneshop.lisa.model.PassageMetadata;
import com.example.phoneshop.lisa.model.RankedResult;
import com.example.phoneshop.lisa.model.ResultSource;

public final class Passages {

  private Passages() {}

  public static Passage passage(String id, String productId, String content) {
    return new Passage(id, content,
        new PassageMetadata(productId, "Title " + productId, "https://shop.example/" + productId,
            "1000", "https://shop.example/img/" + productId + ".jpg", "specs"));
  }

  public static RankedResult ranked(String id, String productId, double score, ResultSource source) {
    return new RankedResult(passage(id, productId, "content of " + id), score, source);
  }
}
