package com.docintegrity.analysis.service.detection;

import com.docintegrity.analysis.client.ClassifierProvider;
import com.docintegrity.analysis.client.ClassifierVerdict;
import com.docintegrity.analysis.client.ProviderException;
import com.docintegrity.analysis.client.ProviderPermanentException;
import com.docintegrity.analysis.domain.ClassifierOutcome;
import com.docintegrity.analysis.service.support.ProviderCallRunner;
import com.docintegrity.analysis.service.support.TimeBudget;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ClassifierGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClassifierGateway.class);

    private final List<ClassifierProvider> chain;
    private final ProviderCallRunner callRunner;
    private final int excerptChars;
    private final boolean corroborate;

    public ClassifierGateway(List<ClassifierProvider> chain, ProviderCallRunner callRunner, int excerptChars, boolean corroborate) {
        this.chain = List.copyOf(chain);
        this.callRunner = callRunner;
        this.excerptChars = excerptChars;
        this.corroborate = corroborate;
    }

    public boolean hasProviders() {
        return !chain.isEmpty();
    }

    public ClassifierOutcome classify(String text, TimeBudget budget) {
        String excerpt = text.length() <= excerptChars ? text : text.substring(0, excerptChars);
        List<String> failures = new ArrayList<>();
        Set<String> disabled = new HashSet<>();

        for (int position = 0; position < chain.size(); position++) {
            ClassifierProvider provider = chain.get(position);
            ClassifierVerdict verdict = attempt(provider, excerpt, budget, failures, disabled);
            if (verdict == null) {
                continue;
            }
            if (position > 0) {
                LOGGER.info("Classifier fallback: {} answered after {} failed provider(s)", provider.id(), position);
            }
            if (corroborate) {
                return corroborated(provider, position, verdict, excerpt, budget, failures, disabled);
            }
            return new ClassifierOutcome.Available(
                provider.id(), position, verdict.probability(), verdict.label(), verdict.rawConfidence(), null, failures);
        }

        if (!chain.isEmpty()) {
            LOGGER.warn("All {} classifier provider(s) failed, using heuristic-only scoring", chain.size());
        }
        return new ClassifierOutcome.Unavailable(failures);
    }

    private ClassifierOutcome corroborated(
        ClassifierProvider first,
        int position,
        ClassifierVerdict verdict,
        String excerpt,
        TimeBudget budget,
        List<String> failures,
        Set<String> disabled
    ) {
        for (int next = position + 1; next < chain.size(); next++) {
            ClassifierProvider second = chain.get(next);
            ClassifierVerdict other = attempt(second, excerpt, budget, failures, disabled);
            if (other != null) {
                double averaged = (verdict.probability() + other.probability()) / 2.0;
                return new ClassifierOutcome.Available(
                    first.id(), position, averaged, verdict.label(), verdict.rawConfidence(), second.id(), failures);
            }
        }
        return new ClassifierOutcome.Available(
            first.id(), position, verdict.probability(), verdict.label(), verdict.rawConfidence(), null, failures);
    }

    private ClassifierVerdict attempt(
        ClassifierProvider provider,
        String excerpt,
        TimeBudget budget,
        List<String> failures,
        Set<String> disabled
    ) {
        if (disabled.contains(provider.id())) {
            return null;
        }
        if (budget.exhausted()) {
            failures.add(provider.id() + ": skipped, request budget exhausted");
            return null;
        }
        try {
            return callRunner.callWithRetry(provider.id(), () -> provider.classify(excerpt), budget);
        } catch (ProviderPermanentException ex) {
            LOGGER.warn("Classifier {} unavailable for this request: {}", provider.id(), ex.getMessage());
            disabled.add(provider.id());
            failures.add(ex.getMessage());
        } catch (ProviderException ex) {
            LOGGER.warn("Classifier {} failed: {}", provider.id(), ex.getMessage());
            failures.add(ex.getMessage());
        }
        return null;
    }
}
