package com.docintegrity.analysis.domain;

import java.util.List;

public sealed interface ClassifierOutcome permits ClassifierOutcome.Available, ClassifierOutcome.Unavailable {

    List<String> failures();

    record Available(
        String providerId,
        int chainPosition,
        double probability,
        String label,
        Double rawConfidence,
        String corroboratedBy,
        List<String> failures
    ) implements ClassifierOutcome {

        public Available {
            failures = List.copyOf(failures);
        }
    }

    record Unavailable(List<String> failures) implements ClassifierOutcome {

        public Unavailable {
            failures = List.copyOf(failures);
        }
    }
}
