package com.herzen.unlock;

import com.herzen.unlock.domain.DomainModels.EdgeKind;
import com.herzen.unlock.domain.DomainModels.Threshold;
import com.herzen.unlock.domain.DomainModels.ThresholdMetric;
import com.herzen.unlock.parser.ParserDtos.RawRulePayload;
import com.herzen.unlock.parser.ParserDtos.Requirement;
import com.herzen.unlock.parser.RuleParser;
import com.herzen.unlock.parser.TokenParseException;
import com.herzen.unlock.validation.DiagnosticType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class RuleParserTest {
    @Autowired
    private RuleParser parser;

    @Test
    void parsesPercentSuffixAsSuccessRate() {
        for (String percent : List.of("0", "1", "33.5", "60", "70", "99.9", "100")) {
            Requirement requirement = parser.parseRequirement("M1O1A1@" + percent + "%");
            assertEquals("M1O1A1", requirement.sourceCode());
            assertEquals(ThresholdMetric.SUCCESS_RATE, requirement.threshold().metric());
            assertEquals(Double.parseDouble(percent) / 100.0, requirement.threshold().value(), 1e-12);
        }
    }

    @Test
    void parsesLevelSuffixAsInteger() {
        for (int level : List.of(0, 1, 2, 17)) {
            Requirement requirement = parser.parseRequirement("M1O2#" + level);
            assertEquals("M1O2", requirement.sourceCode());
            assertEquals(Threshold.level(level), requirement.threshold());
        }
    }

    @Test
    void tokenWithoutSuffixIsUnconditional() {
        Requirement requirement = parser.parseRequirement("  M1O3A2 ");
        assertEquals("M1O3A2", requirement.sourceCode());
        assertNull(requirement.threshold());
    }

    @Test
    void acceptsParenthesizedPercentForm() {
        Requirement requirement = parser.parseRequirement("M31O1A2(75%)");
        assertEquals("M31O1A2", requirement.sourceCode());
        assertEquals(0.75, requirement.threshold().value(), 1e-12);
    }

    @Test
    void acceptsLeadingDecimalPointInPercent() {
        assertEquals(0.005, parser.parseRequirement("M1O1A1@.5%").threshold().value(), 1e-12);
        assertEquals(0.005, parser.parseRequirement("M1O1A1(.5%)").threshold().value(), 1e-12);
    }

    @Test
    void toleratesWhitespaceAroundSuffixes() {
        var result = parser.parseRulePayload(RawRulePayload.of("A9",
                List.of("A1 @ 60 %, A2 (75%)"), List.of("B2 # 3"), false));

        assertTrue(result.errors().isEmpty(), result.errors().toString());
        var activation = result.specs().stream().filter(s -> s.direction() == EdgeKind.ACTIVATION).findFirst().orElseThrow();
        assertEquals(List.of(new Requirement("A1", Threshold.successRate(0.6)), new Requirement("A2", Threshold.successRate(0.75))),
                activation.requirements());
        var deactivation = result.specs().stream().filter(s -> s.direction() == EdgeKind.DEACTIVATION).findFirst().orElseThrow();
        assertEquals(List.of(new Requirement("B2", Threshold.level(3))), deactivation.requirements());
    }

    @Test
    void rejectsMalformedTokens() {
        for (String token : List.of("A1@101%", "A1@-5%", "A1@abc%", "A1@70", "A1#-1", "A1#2.5", "A1#x",
                "@70%", "#2", "", "   ", "A1%", "A1(70%")) {
            TokenParseException e = assertThrows(TokenParseException.class, () -> parser.parseRequirement(token), token);
            assertNotNull(e.getToken());
        }
    }

    @Test
    void splitsMultiTokenEntriesAndCollapsesDuplicates() {
        var result = parser.parseRulePayload(RawRulePayload.of("M31O2A1",
                List.of("M31O1A1, M31O1A2(75%), M31O2", "M31O1A1"),
                List.of("M31O3A1#2"),
                false));

        assertTrue(result.errors().isEmpty());
        assertEquals(2, result.specs().size());

        var activation = result.specs().stream().filter(s -> s.direction() == EdgeKind.ACTIVATION).findFirst().orElseThrow();
        assertEquals(List.of("M31O1A1", "M31O1A2", "M31O2"), activation.requirements().stream().map(Requirement::sourceCode).toList());
        assertEquals(0.75, activation.requirements().get(1).threshold().value(), 1e-12);

        var deactivation = result.specs().stream().filter(s -> s.direction() == EdgeKind.DEACTIVATION).findFirst().orElseThrow();
        assertEquals(List.of(new Requirement("M31O3A1", Threshold.level(2))), deactivation.requirements());
    }

    @Test
    void reportsBadTokenAndKeepsTheRestOfThePayload() {
        var result = parser.parseRulePayload(RawRulePayload.of("A3", List.of("A1@70%", "A2@150%", ""), List.of(), true));

        assertEquals(2, result.errors().size());
        assertTrue(result.errors().stream().allMatch(e -> e.type() == DiagnosticType.TOKEN_PARSE_ERROR));
        assertTrue(result.errors().stream().anyMatch(e -> e.subject().equals("A3:activation:A2@150%")));

        var activation = result.specs().get(0);
        assertEquals(List.of("A1"), activation.requirements().stream().map(Requirement::sourceCode).toList());
        assertTrue(activation.initiallyOpen());
    }

    @Test
    void rejectsPayloadWithoutTarget() {
        var result = parser.parseRulePayload(RawRulePayload.of(" ", List.of("A1"), List.of(), false));
        assertTrue(result.specs().isEmpty());
        assertEquals(DiagnosticType.TOKEN_PARSE_ERROR, result.errors().get(0).type());
    }
}
