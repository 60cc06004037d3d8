package com.momoledger.ingestion.classifier;

import com.momoledger.domain.TransactionCategory;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One (predicate, category) pair of the classifier's ordered rule list.
 */
public record ClassificationRule(String name, Predicate<String> predicate, TransactionCategory category) {

    public ClassificationRule {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(category, "category");
    }

    public boolean matches(String body) {
        return predicate.test(body);
    }

    /** Case-sensitive: every fragment must occur somewhere in the body. */
    public static ClassificationRule containsAll(TransactionCategory category, String... fragments) {
        return new ClassificationRule(
                String.join(" & ", fragments),
                body -> Arrays.stream(fragments).allMatch(body::contains),
                category);
    }

    public static ClassificationRule matches(TransactionCategory category, Pattern pattern) {
        return new ClassificationRule(pattern.pattern(), body -> pattern.matcher(body).find(), category);
    }
}
