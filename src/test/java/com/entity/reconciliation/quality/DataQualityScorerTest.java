package com.entity.reconciliation.quality;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataQualityScorer Tests")
class DataQualityScorerTest {

    private final DataQualityScorer scorer = new DataQualityScorer();

    private static final List<QualityRule> VETERAN_RULES = List.of(
            QualityRule.anyOf(List.of("va_file_number", "ssn"), 20, "identifier"),
            QualityRule.notNull("first_name", 15, "first name"),
            QualityRule.notNull("last_name", 15, "last name"),
            QualityRule.notNull("date_of_birth", 15, "DOB"),
            QualityRule.pattern("email", 10, "email", "^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$"),
            QualityRule.pattern("phone", 10, "phone", "^[0-9]{10}$"),
            QualityRule.notNull("state", 5, "state"),
            QualityRule.range("disability_rating", 10, "disability rating", 0, 100));

    private static Map<String, Object> completeVeteran() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("ssn", "123456789");
        attributes.put("first_name", "JOHN");
        attributes.put("last_name", "DOE");
        attributes.put("date_of_birth", LocalDate.of(1970, 1, 1));
        attributes.put("email", "john@example.com");
        attributes.put("phone", "5551234567");
        attributes.put("state", "CA");
        attributes.put("disability_rating", 50L);
        return attributes;
    }

    @Nested
    @DisplayName("Scoring")
    class ScoringTests {

        @Test
        @DisplayName("Complete record scores 100 with no issues")
        void completeRecord() {
            QualityResult result = scorer.score(completeVeteran(), VETERAN_RULES);
            assertEquals(100, result.score());
            assertTrue(result.issues().isEmpty());
        }

        @Test
        @DisplayName("Score is capped at 100")
        void cappedScore() {
            List<QualityRule> generous = List.of(
                    QualityRule.notNull("first_name", 80, "first name"),
                    QualityRule.notNull("last_name", 80, "last name"));

            assertEquals(100, scorer.score(completeVeteran(), generous).score());
        }

        @Test
        @DisplayName("Empty record scores 0 and reports every rule")
        void emptyRecord() {
            QualityResult result = scorer.score(Map.of(), VETERAN_RULES);
            assertEquals(0, result.score());
            assertEquals(List.of("Missing identifier", "Missing first name", "Missing last name", "Missing DOB",
                    "Missing email", "Missing phone", "Missing state", "Missing disability rating"), result.issues());
        }

        @Test
        @DisplayName("No rules score 0")
        void noRules() {
            assertEquals(0, scorer.score(completeVeteran(), List.of()).score());
        }
    }

    @Nested
    @DisplayName("Issue tags")
    class IssueTests {

        @Test
        @DisplayName("Present but invalid values are tagged Invalid")
        void invalidValues() {
            Map<String, Object> attributes = completeVeteran();
            attributes.put("email", "not-an-email");
            attributes.put("disability_rating", 150L);

            QualityResult result = scorer.score(attributes, VETERAN_RULES);

            assertEquals(80, result.score());
            assertEquals(List.of("Invalid email", "Invalid disability rating"), result.issues());
        }

        @Test
        @DisplayName("Unparseable numbers fail range checks")
        void unparseableNumber() {
            Map<String, Object> attributes = completeVeteran();
            attributes.put("disability_rating", "fifty");

            assertEquals(List.of("Invalid disability rating"), scorer.score(attributes, VETERAN_RULES).issues());
        }

        @Test
        @DisplayName("Range bounds are inclusive and accept decimals")
        void rangeBounds() {
            QualityRule rule = QualityRule.range("disability_rating", 10, "rating", 0, 100);
            assertEquals(10, scorer.score(Map.of("disability_rating", 100L), List.of(rule)).score());
            assertEquals(10, scorer.score(Map.of("disability_rating", new BigDecimal("0")), List.of(rule)).score());
            assertEquals(0, scorer.score(Map.of("disability_rating", -1L), List.of(rule)).score());
        }

        @Test
        @DisplayName("Blank strings count as missing")
        void blankIsMissing() {
            Map<String, Object> attributes = completeVeteran();
            attributes.put("first_name", "  ");

            assertEquals(List.of("Missing first name"), scorer.score(attributes, VETERAN_RULES).issues());
        }

        @Test
        @DisplayName("ANY_OF passes when either field is present")
        void anyOf() {
            Map<String, Object> attributes = completeVeteran();
            attributes.remove("ssn");
            attributes.put("va_file_number", "C1234567");

            assertTrue(scorer.score(attributes, VETERAN_RULES).issues().isEmpty());
        }

        @Test
        @DisplayName("ONE_OF compares string forms")
        void oneOf() {
            QualityRule rule = QualityRule.oneOf("active", 5, "active flag", Set.of("true"));
            assertEquals(5, scorer.score(Map.of("active", Boolean.TRUE), List.of(rule)).score());
            assertEquals(List.of("Invalid active flag"),
                    scorer.score(Map.of("active", Boolean.FALSE), List.of(rule)).issues());
        }
    }

    @Test
    @DisplayName("Labels default to the field name")
    void defaultLabel() {
        QualityRule rule = QualityRule.notNull("license_state", 10, null);
        assertEquals("license state", rule.label());
    }
}
