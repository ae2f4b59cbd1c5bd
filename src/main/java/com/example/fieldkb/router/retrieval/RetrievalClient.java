package com.example.fieldkb.router.retrieval;

import com.example.fieldkb.router.model.MatchedItem;

import java.time.Duration;
import java.util.List;

/** Ranked knowledge-item search. Implementations throw when the search fails or exceeds the timeout. */
public interface RetrievalClient {

    List<MatchedItem> search(String text, int k, Duration timeout);
}
