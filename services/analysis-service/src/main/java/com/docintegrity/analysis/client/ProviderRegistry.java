package com.docintegrity.analysis.client;

import java.util.List;
import java.util.Optional;

public record ProviderRegistry(List<ClassifierProvider> classifiers, SearchProvider searchProvider) {

    public ProviderRegistry {
        classifiers = List.copyOf(classifiers);
    }

    public Optional<SearchProvider> search() {
        return Optional.ofNullable(searchProvider);
    }

    public List<String> classifierIds() {
        return classifiers.stream().map(ClassifierProvider::id).toList();
    }
}
