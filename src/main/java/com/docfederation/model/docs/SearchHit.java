package com.docfederation.model.docs;

public record SearchHit(String unifiedPath,
                        String title,
                        String snippet,
                        String repository,
                        double score) {
}
