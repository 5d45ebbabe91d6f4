package com.docintegrity.analysis.client;

import com.docintegrity.analysis.domain.SearchHit;
import java.util.List;

public interface SearchProvider {

    String id();

    List<SearchHit> search(String query, int maxResults);
}
