package com.docintegrity.analysis.testing;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class Fixtures {

    /** Twelve evenly sized sentences built from a handful of words. */
    public static final String UNIFORM_TEXT = String.join(" ",
        "The platform offers a robust solution for modern data processing.",
        "The solution provides a robust platform for modern data analysis.",
        "The framework offers a robust approach for modern data management.",
        "The approach provides a robust framework for modern data processing.",
        "The platform offers a scalable solution for modern data analysis.",
        "The solution provides a scalable platform for modern data management.",
        "The platform offers a robust solution for modern data processing.",
        "The solution provides a robust platform for modern data analysis.",
        "The framework offers a robust approach for modern data management.",
        "The approach provides a robust framework for modern data processing.",
        "The platform offers a scalable solution for modern data analysis.",
        "The solution provides a scalable platform for modern data management."
    );

    /** Two sentences lifted word for word from {@link #SOURCE_PAGE}. */
    public static final String COPIED_PASSAGE =
        "Honey bees communicate the location of distant flowers through a waggle dance whose angle "
            + "encodes direction relative to the sun. The duration of each waggle run tells nestmates how far "
            + "they must fly.";

    public static final String SOURCE_PAGE = "Foraging and recruitment. " + COPIED_PASSAGE
        + " Scout bees return to the hive and repeat the dance many times.";

    public static final String SOURCE_URL = "https://pollinators.example.org/foraging";

    /** The copied passage followed by one original sentence of similar length. */
    public static final String PARTLY_COPIED_TEXT = COPIED_PASSAGE
        + " In my own small garden I have watched this behaviour only once, on a bright June morning, and I "
        + "remember thinking that it looked far less like a dance than a heated argument between very small "
        + "and very determined neighbours.";

    private Fixtures() {
    }

    /** About six hundred words of personal essay with very uneven sentence lengths. */
    public static String humanEssay() {
        return resource("/fixtures/human-essay.txt");
    }

    public static String resource(String path) {
        try (InputStream in = Fixtures.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
