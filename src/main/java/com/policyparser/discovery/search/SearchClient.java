package com.policyparser.discovery.search;

import java.util.List;

public interface SearchClient {

    String name();

    List<SearchModels.SearchHit> search(String query, long timeoutMs);
}
