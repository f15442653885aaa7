package com.rolefit.matcher.document;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class RoleTextCleanerTest {

    private final RoleTextCleaner cleaner = new RoleTextCleaner();

    @Test
    void shouldDropCompanyAndBenefitsSections() throws IOException {
        // Given
        String role = fixture("role-data-engineer.txt");

        // When
        String cleaned = cleaner.clean(role);

        // Then
        assertThat(cleaned)
            .contains("Python and SQL")
            .contains("Kafka")
            .doesNotContain("Our mission")
            .doesNotContain("Health insurance");
    }

    @Test
    void shouldKeepOriginalWhenCleaningLeavesTooLittle() {
        // Given - nearly everything sits under "About us"
        String role = "About us\nWe build things.\nResponsibilities\n- Code";

        // When
        String cleaned = cleaner.clean(role);

        // Then
        assertThat(cleaned).isEqualTo(role);
    }

    @Test
    void shouldResumeAfterRelevantHeading() {
        String role = """
            Benefits
            Unlimited coffee and snacks for the whole team, every single day of the week.
            Requirements
            Strong experience with Python, SQL, Spark and cloud data platforms such as AWS or GCP.
            Comfortable owning production pipelines end to end.
            """;

        String cleaned = cleaner.clean(role);

        assertThat(cleaned).startsWith("Requirements").doesNotContain("coffee");
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = RoleTextCleanerTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
