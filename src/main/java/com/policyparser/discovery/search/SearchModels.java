package com.policyparser.discovery.search;

import java.util.List;

public class SearchModels {

    public record SearchHit(String url, String title, String provider) {
    }

    public record SerperResponse(List<SerperOrganic> organic) {
    }

    public record SerperOrganic(String title, String link, String snippet) {
    }
}
