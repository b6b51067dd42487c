package com.bank.categorization.engine;

import com.bank.categorization.model.LearnedRule;
import com.bank.categorization.model.MatchType;
import com.bank.categorization.model.RuleMatch;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores learned rules against a normalized input and picks the best one.
 */
@Component
public class RuleMatcher {

    static final double EXACT_SCORE = 100;
    static final double INPUT_CONTAINS_SIGNATURE_SCORE = 80;
    static final double SIGNATURE_CONTAINS_INPUT_SCORE = 75;
    static final double KEYWORD_WEIGHT = 70;
    static final double DESCRIPTION_SCORE = 50;

    private static final Comparator<RuleMatch> BEST_FIRST = Comparator
            .comparingDouble(RuleMatch::matchScore)
            .thenComparingInt(m -> m.rule().getSupportCount());

    public Optional<RuleMatch> bestMatch(NormalizedInput input, List<LearnedRule> rules) {
        return rules.stream()
                .map(rule -> score(input, rule))
                .flatMap(Optional::stream)
                .max(BEST_FIRST);
    }

    public Optional<RuleMatch> score(NormalizedInput input, LearnedRule rule) {
        String ruleSignature = rule.getSignature();
        if (ruleSignature == null || ruleSignature.isBlank()) {
            return Optional.empty();
        }
        String signature = input.signature();

        if (!signature.isEmpty()) {
            if (signature.equals(ruleSignature)) {
                return Optional.of(new RuleMatch(rule, EXACT_SCORE, MatchType.EXACT_SIGNATURE));
            }
            if (signature.contains(ruleSignature)) {
                return Optional.of(new RuleMatch(rule, INPUT_CONTAINS_SIGNATURE_SCORE, MatchType.PARTIAL_SIGNATURE));
            }
            if (ruleSignature.contains(signature)) {
                return Optional.of(new RuleMatch(rule, SIGNATURE_CONTAINS_INPUT_SCORE, MatchType.PARTIAL_SIGNATURE));
            }
        }

        List<String> ruleKeywords = rule.getKeywords();
        if (ruleKeywords != null && !ruleKeywords.isEmpty() && !input.keywords().isEmpty()) {
            long matched = ruleKeywords.stream().filter(input.keywords()::contains).count();
            if (matched > 0) {
                double ratio = (double) matched / ruleKeywords.size();
                return Optional.of(new RuleMatch(rule, KEYWORD_WEIGHT * ratio, MatchType.KEYWORD));
            }
        }

        if (input.inputText() != null && input.inputText().toUpperCase(Locale.ROOT).contains(ruleSignature)) {
            return Optional.of(new RuleMatch(rule, DESCRIPTION_SCORE, MatchType.DESCRIPTION));
        }
        return Optional.empty();
    }
}
